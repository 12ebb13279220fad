package com.sbomcheck.core.report;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a violation.
 *
 * <p>Specification rules report {@link #ERROR}, policy rules report {@link #WARNING}.
 * Both fail the document; the severity lets renderers and exit-code thresholds tell
 * them apart. Declaration order is ascending severity.
 */
public enum Severity {
    /** A configured minimum-required-value rule failed */
    WARNING,

    /** The document does not conform to SPDX 2.3 */
    ERROR;

    /**
     * Returns the lowercase name used in JSON and CSV output.
     *
     * @return {@code "warning"} or {@code "error"}
     */
    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns true if this severity is at least as severe as the given threshold.
     *
     * @param threshold minimum severity
     * @return true if this severity meets the threshold
     */
    public boolean isAtLeast(Severity threshold) {
        return compareTo(threshold) >= 0;
    }
}
