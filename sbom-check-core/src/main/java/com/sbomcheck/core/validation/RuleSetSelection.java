package com.sbomcheck.core.validation;

/**
 * Which rule sets a run evaluates.
 */
public enum RuleSetSelection {
    SPECIFICATION(true, false),
    POLICY(false, true),
    BOTH(true, true);

    private final boolean specification;
    private final boolean policy;

    RuleSetSelection(boolean specification, boolean policy) {
        this.specification = specification;
        this.policy = policy;
    }

    public boolean includesSpecification() {
        return specification;
    }

    public boolean includesPolicy() {
        return policy;
    }
}
