package com.sbomcheck.core.rule.policy;

import com.sbomcheck.core.config.CheckType;
import com.sbomcheck.core.config.PolicyCheck;
import com.sbomcheck.core.config.PolicyConfig;
import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.rule.Rule;
import com.sbomcheck.core.rule.RuleSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Minimum-required-value rules built from a {@link PolicyConfig}.
 *
 * <p>Every violation has severity warning and the code
 * {@code POLICY:<Entity>.<fieldPath>:<check>}. An empty policy yields no rules.
 */
public final class PolicyRuleSet implements RuleSet {

    public static final String NAME = "policy";

    private final List<Rule> rules;

    public PolicyRuleSet(PolicyConfig config) {
        List<Rule> built = new ArrayList<>();
        for (Map.Entry<EntityType, List<PolicyCheck>> entry : config.checks().entrySet()) {
            for (PolicyCheck check : entry.getValue()) {
                if (check.check() == CheckType.DESCRIBES_FIRST_PACKAGE) {
                    built.add(new DescribesFirstPackageRule(check));
                } else {
                    built.add(new FieldPolicyRule(entry.getKey(), check));
                }
            }
        }
        this.rules = List.copyOf(built);
    }

    static String code(EntityType target, PolicyCheck check) {
        return "POLICY:" + target.label() + "." + check.fieldPath() + ":" + check.check().configName();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<Rule> getRules() {
        return rules;
    }
}
