package com.sbomcheck.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One configured minimum-required-value check.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * - fieldPath: copyrightText
 *   check: required
 *   message: This file has a concluded license but no copyright text.
 *   when:
 *     - fieldPath: licenseConcluded
 *       check: nonPlaceholder
 * }</pre>
 *
 * @param fieldPath dotted SPDX JSON field path; arrays fan out
 * @param check check to apply
 * @param allowedValues values accepted by oneOf
 * @param minItems minimum array size for minItems
 * @param when conditions, any of which enables the check; empty means always
 * @param message custom violation message, null for the generated one
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PolicyCheck(
    @JsonProperty("fieldPath") String fieldPath,
    @JsonProperty("check") CheckType check,
    @JsonProperty("allowedValues") List<String> allowedValues,
    @JsonProperty("minItems") Integer minItems,
    @JsonProperty("when") List<PolicyCondition> when,
    @JsonProperty("message") String message
) {
    /** Field reported by the describesFirstPackage check when no fieldPath is configured */
    public static final String DESCRIBES_FIELD = "relationships";

    /**
     * Compact constructor with validation.
     */
    public PolicyCheck {
        if (check == null) {
            throw new PolicyConfigurationException("check is required"
                + (fieldPath == null ? "" : " for '" + fieldPath + "'"));
        }
        if (check == CheckType.DESCRIBES_FIRST_PACKAGE && (fieldPath == null || fieldPath.isBlank())) {
            fieldPath = DESCRIBES_FIELD;
        }
        if (fieldPath == null || fieldPath.isBlank()) {
            throw new PolicyConfigurationException("fieldPath is required for check " + check.configName());
        }
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
        when = when == null ? List.of() : List.copyOf(when);
        if (check == CheckType.ONE_OF && allowedValues.isEmpty()) {
            throw new PolicyConfigurationException("oneOf check on '" + fieldPath + "' needs allowedValues");
        }
        if (check == CheckType.MIN_ITEMS && (minItems == null || minItems < 1)) {
            throw new PolicyConfigurationException("minItems check on '" + fieldPath + "' needs minItems of at least 1");
        }
    }

    /**
     * Creates an unconditional check without allowed values.
     *
     * @param fieldPath field path
     * @param check required or nonPlaceholder
     * @return check
     */
    public static PolicyCheck of(String fieldPath, CheckType check) {
        return new PolicyCheck(fieldPath, check, List.of(), null, List.of(), null);
    }

    /**
     * Creates an unconditional oneOf check.
     *
     * @param fieldPath field path
     * @param allowedValues accepted values
     * @return check
     */
    public static PolicyCheck oneOf(String fieldPath, List<String> allowedValues) {
        return new PolicyCheck(fieldPath, CheckType.ONE_OF, allowedValues, null, List.of(), null);
    }
}
