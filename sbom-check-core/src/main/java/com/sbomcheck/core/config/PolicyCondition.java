package com.sbomcheck.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Guard of a {@link PolicyCheck}: the check only runs on entities where the condition holds,
 * that is where this check would pass.
 *
 * @param fieldPath dotted field path
 * @param check required, nonPlaceholder or oneOf
 * @param allowedValues values accepted by oneOf
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PolicyCondition(
    @JsonProperty("fieldPath") String fieldPath,
    @JsonProperty("check") CheckType check,
    @JsonProperty("allowedValues") List<String> allowedValues
) {
    /**
     * Compact constructor with validation.
     */
    public PolicyCondition {
        if (fieldPath == null || fieldPath.isBlank()) {
            throw new PolicyConfigurationException("condition fieldPath is required");
        }
        if (check == null) {
            throw new PolicyConfigurationException("condition on '" + fieldPath + "' has no check");
        }
        if (check == CheckType.MIN_ITEMS || check == CheckType.DESCRIBES_FIRST_PACKAGE) {
            throw new PolicyConfigurationException("condition on '" + fieldPath + "' cannot use check "
                + check.configName());
        }
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
        if (check == CheckType.ONE_OF && allowedValues.isEmpty()) {
            throw new PolicyConfigurationException("oneOf condition on '" + fieldPath + "' needs allowedValues");
        }
    }
}
