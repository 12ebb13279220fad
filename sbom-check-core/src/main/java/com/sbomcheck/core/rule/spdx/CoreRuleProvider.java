package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.rule.Rule;
import com.sbomcheck.core.rule.RuleProvider;

import java.util.List;

/**
 * Rules that apply to every entity type: binding issues and duplicate identifiers.
 */
public class CoreRuleProvider implements RuleProvider {

    private final List<Rule> rules = List.of(
        new StructureRule(),
        new DuplicateIdRule()
    );

    @Override
    public String getId() {
        return "spdx-core";
    }

    @Override
    public String getSpdxVersion() {
        return SpdxFormats.SPDX_VERSION;
    }

    @Override
    public int getPriority() {
        return 0;
    }

    @Override
    public List<Rule> getRules() {
        return rules;
    }
}
