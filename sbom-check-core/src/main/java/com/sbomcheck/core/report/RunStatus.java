package com.sbomcheck.core.report;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Overall outcome of a validation run.
 */
public enum RunStatus {
    PASS,
    FAIL;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
