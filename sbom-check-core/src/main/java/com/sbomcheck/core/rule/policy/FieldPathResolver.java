package com.sbomcheck.core.rule.policy;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Resolves dotted field paths against an SPDX JSON tree.
 *
 * <p>Arrays met before the last segment fan out: {@code checksums.algorithm} yields one node
 * per checksum. An array at the last segment is returned as a single node. Absent fields
 * resolve to a missing node, so every element of a fan-out is represented.
 */
final class FieldPathResolver {

    private static final Pattern SEPARATOR = Pattern.compile("\\.");

    private FieldPathResolver() {
    }

    static List<JsonNode> resolve(JsonNode root, String fieldPath) {
        List<JsonNode> current = List.of(root);
        for (String segment : SEPARATOR.split(fieldPath)) {
            List<JsonNode> next = new ArrayList<>();
            for (JsonNode node : current) {
                if (node.isArray()) {
                    node.forEach(element -> next.add(element.path(segment)));
                } else {
                    next.add(node.path(segment));
                }
            }
            current = next;
        }
        return current;
    }

    /**
     * Flattens resolved nodes into their present scalar values; arrays contribute their elements.
     */
    static List<JsonNode> scalarValues(List<JsonNode> nodes) {
        List<JsonNode> values = new ArrayList<>();
        for (JsonNode node : nodes) {
            if (node.isArray()) {
                node.forEach(element -> {
                    if (element.isValueNode() && !element.isNull()) {
                        values.add(element);
                    }
                });
            } else if (node.isValueNode() && !node.isNull()) {
                values.add(node);
            }
        }
        return values;
    }

    static boolean isEmpty(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return true;
        }
        if (node.isTextual()) {
            return node.asText().isBlank();
        }
        if (node.isContainerNode()) {
            return node.isEmpty();
        }
        return false;
    }
}
