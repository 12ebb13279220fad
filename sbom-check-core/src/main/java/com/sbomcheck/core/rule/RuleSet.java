package com.sbomcheck.core.rule;

import java.util.List;

/**
 * An ordered, immutable group of rules that can be enabled or disabled as a whole.
 */
public interface RuleSet {

    /**
     * Returns the name of this rule set, used in logs and listings.
     *
     * @return name such as {@code specification} or {@code policy}
     */
    String getName();

    /**
     * Returns the rules in evaluation order.
     *
     * @return rules
     */
    List<Rule> getRules();
}
