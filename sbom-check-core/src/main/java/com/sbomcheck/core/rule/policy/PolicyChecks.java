package com.sbomcheck.core.rule.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.sbomcheck.core.config.CheckType;
import com.sbomcheck.core.license.LicenseExpressions;

import java.util.List;

/**
 * Predicates behind the configurable checks, shared by checks and their conditions.
 */
final class PolicyChecks {

    private PolicyChecks() {
    }

    static boolean required(List<JsonNode> nodes) {
        return !nodes.isEmpty() && nodes.stream().noneMatch(FieldPathResolver::isEmpty);
    }

    static boolean nonPlaceholder(List<JsonNode> nodes) {
        return required(nodes) && FieldPathResolver.scalarValues(nodes).stream()
            .noneMatch(value -> LicenseExpressions.isPlaceholderIgnoreCase(value.asText()));
    }

    static boolean oneOf(List<JsonNode> nodes, List<String> allowedValues) {
        return FieldPathResolver.scalarValues(nodes).stream()
            .allMatch(value -> allowedValues.contains(value.asText()));
    }

    static boolean minItems(List<JsonNode> nodes, int minItems) {
        return !nodes.isEmpty() && nodes.stream().allMatch(node -> node.isArray() && node.size() >= minItems);
    }

    static boolean passes(CheckType check, List<JsonNode> nodes, List<String> allowedValues, Integer minItems) {
        return switch (check) {
            case REQUIRED -> required(nodes);
            case NON_PLACEHOLDER -> nonPlaceholder(nodes);
            case ONE_OF -> oneOf(nodes, allowedValues);
            case MIN_ITEMS -> minItems(nodes, minItems);
            case DESCRIBES_FIRST_PACKAGE -> throw new IllegalArgumentException("not a field check: " + check);
        };
    }
}
