package com.sbomcheck.core.report;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of validating one document.
 */
public enum DocumentStatus {
    /** Evaluated without any violation */
    PASS,

    /** Evaluated with at least one violation */
    FAIL,

    /** Could not be read or parsed as JSON */
    UNREADABLE,

    /** Not evaluated because the run was cancelled */
    SKIPPED;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
