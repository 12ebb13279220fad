package com.sbomcheck.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * External reference categories defined by SPDX 2.3 (clause 7.21).
 *
 * <p>The JSON schema accepts both the hyphenated and the underscored spelling.
 */
public enum ExternalRefCategory {
    SECURITY,
    PACKAGE_MANAGER,
    PERSISTENT_ID,
    OTHER;

    public static Optional<ExternalRefCategory> fromSpdxName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.replace('-', '_');
        return Arrays.stream(values())
            .filter(category -> category.name().equals(normalized))
            .findFirst();
    }
}
