package com.sbomcheck.core.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Checks a policy can apply to a field.
 */
public enum CheckType {
    /** Field is present and neither an empty string nor an empty array */
    REQUIRED("required"),

    /** Field is required and no value equals NOASSERTION or NONE, ignoring case */
    NON_PLACEHOLDER("nonPlaceholder"),

    /** Every present value is one of the allowed values */
    ONE_OF("oneOf"),

    /** Array field has at least the configured number of items */
    MIN_ITEMS("minItems"),

    /** The single element the document describes is its first package (Document only) */
    DESCRIBES_FIRST_PACKAGE("describesFirstPackage");

    private final String configName;

    CheckType(String configName) {
        this.configName = configName;
    }

    @JsonValue
    public String configName() {
        return configName;
    }

    /**
     * Looks up a check by its configuration name.
     *
     * @param name name such as {@code nonPlaceholder}
     * @return matching check
     * @throws PolicyConfigurationException if the name is unknown
     */
    @JsonCreator
    public static CheckType fromConfigName(String name) {
        return Arrays.stream(values())
            .filter(type -> type.configName.equals(name))
            .findFirst()
            .orElseThrow(() -> new PolicyConfigurationException("unknown check '" + name + "', expected one of "
                + Arrays.stream(values()).map(CheckType::configName).collect(Collectors.joining(", "))));
    }
}
