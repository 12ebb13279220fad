package com.sbomcheck.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Primary package purposes defined by SPDX 2.3 (clause 7.24).
 */
public enum PrimaryPackagePurpose {
    APPLICATION,
    FRAMEWORK,
    LIBRARY,
    CONTAINER,
    OPERATING_SYSTEM,
    DEVICE,
    FIRMWARE,
    SOURCE,
    ARCHIVE,
    FILE,
    INSTALL,
    OTHER;

    public static Optional<PrimaryPackagePurpose> fromSpdxName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(purpose -> purpose.name().equals(value))
            .findFirst();
    }
}
