package com.sbomcheck.core.rule.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.sbomcheck.core.config.CheckType;
import com.sbomcheck.core.config.PolicyCheck;
import com.sbomcheck.core.config.PolicyCondition;
import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.SpdxEntity;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.Violation;
import com.sbomcheck.core.rule.AbstractRule;
import com.sbomcheck.core.rule.RuleContext;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies one configured field check to every entity of its type.
 */
public class FieldPolicyRule extends AbstractRule<SpdxEntity> {

    private final EntityType target;
    private final PolicyCheck check;

    public FieldPolicyRule(EntityType target, PolicyCheck check) {
        super(PolicyRuleSet.code(target, check), describe(target, check), Severity.WARNING, SpdxEntity.class, target);
        this.target = target;
        this.check = check;
    }

    @Override
    protected void check(SpdxEntity entity, RuleContext context, List<Violation> violations) {
        String rootField = check.fieldPath().split("\\.", 2)[0];
        if (context.isUnbound(entity, rootField)) {
            return;
        }
        JsonNode tree = context.entityTree(entity);
        if (!conditionsHold(tree)) {
            return;
        }
        List<JsonNode> nodes = FieldPathResolver.resolve(tree, check.fieldPath());
        if (!PolicyChecks.passes(check.check(), nodes, check.allowedValues(), check.minItems())) {
            violations.add(violation(context, entity, check.fieldPath(), message(nodes)));
        }
    }

    private boolean conditionsHold(JsonNode tree) {
        if (check.when().isEmpty()) {
            return true;
        }
        for (PolicyCondition condition : check.when()) {
            List<JsonNode> nodes = FieldPathResolver.resolve(tree, condition.fieldPath());
            if (PolicyChecks.passes(condition.check(), nodes, condition.allowedValues(), null)) {
                return true;
            }
        }
        return false;
    }

    private String message(List<JsonNode> nodes) {
        if (check.message() != null && !check.message().isBlank()) {
            return check.message();
        }
        String field = target.label() + " " + check.fieldPath();
        return switch (check.check()) {
            case REQUIRED -> field + " is required";
            case NON_PLACEHOLDER -> field + " must be populated with a value other than NOASSERTION or NONE";
            case ONE_OF -> field + " must be one of " + check.allowedValues() + " but was "
                + FieldPathResolver.scalarValues(nodes).stream()
                    .map(JsonNode::asText)
                    .filter(value -> !check.allowedValues().contains(value))
                    .map(value -> "'" + value + "'")
                    .collect(Collectors.joining(", "));
            case MIN_ITEMS -> field + " must have at least " + check.minItems() + " item(s)";
            case DESCRIBES_FIRST_PACKAGE -> field + " failed";
        };
    }

    private static String describe(EntityType target, PolicyCheck check) {
        String base = target.label() + " " + check.fieldPath() + " " + check.check().configName();
        if (check.check() == CheckType.ONE_OF) {
            base += " " + check.allowedValues();
        } else if (check.check() == CheckType.MIN_ITEMS) {
            base += " " + check.minItems();
        }
        return check.when().isEmpty() ? base : base + " (conditional)";
    }
}
