package com.sbomcheck.core.validation;

/**
 * Stages a document passes through, in order. No stage is ever skipped for an evaluated
 * document; resolution cannot fail.
 */
public enum ValidationStage {
    /** JSON read and bound into the document model */
    LOADED,

    /** Identifier index built */
    RESOLVED,

    /** Selected rule sets evaluated */
    RULES_EVALUATED,

    /** Report assembled */
    REPORTED
}
