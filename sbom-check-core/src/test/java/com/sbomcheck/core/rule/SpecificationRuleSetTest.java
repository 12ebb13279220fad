package com.sbomcheck.core.rule;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SpecificationRuleSet}.
 */
class SpecificationRuleSetTest {

    @Test
    void load_discoversAllProvidersInPriorityOrder() {
        SpecificationRuleSet ruleSet = SpecificationRuleSet.load();

        assertThat(ruleSet.getName()).isEqualTo(SpecificationRuleSet.NAME);
        assertThat(ruleSet.getProviders())
            .extracting(RuleProvider::getId)
            .containsExactly(
                "spdx-core", "spdx-document", "spdx-package", "spdx-file",
                "spdx-snippet", "spdx-extracted-license", "spdx-relationship");
        assertThat(ruleSet.getProviders()).allSatisfy(provider ->
            assertThat(provider.getSpdxVersion()).isEqualTo("SPDX-2.3"));
    }

    @Test
    void getRules_concatenatesProviderRules() {
        SpecificationRuleSet ruleSet = SpecificationRuleSet.load();

        int expected = ruleSet.getProviders().stream().mapToInt(provider -> provider.getRules().size()).sum();
        assertThat(ruleSet.getRules()).hasSize(expected);
        assertThat(ruleSet.getRules().get(0).getCode()).isEqualTo("SPDX-STRUCTURE");
    }

    @Test
    void constructor_sortsByPriorityThenId() {
        RuleProvider late = provider("b-late", 5);
        RuleProvider early = provider("z-early", 1);
        RuleProvider tie = provider("a-late", 5);

        SpecificationRuleSet ruleSet = new SpecificationRuleSet(List.of(late, early, tie));

        assertThat(ruleSet.getProviders()).extracting(RuleProvider::getId)
            .containsExactly("z-early", "a-late", "b-late");
    }

    private static RuleProvider provider(String id, int priority) {
        return new RuleProvider() {
            @Override
            public String getId() {
                return id;
            }

            @Override
            public String getSpdxVersion() {
                return "SPDX-2.3";
            }

            @Override
            public int getPriority() {
                return priority;
            }

            @Override
            public List<Rule> getRules() {
                return List.of();
            }
        };
    }
}
