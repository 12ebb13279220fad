package com.sbomcheck.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * File types defined by SPDX 2.3 (clause 8.3).
 */
public enum FileType {
    SOURCE,
    BINARY,
    ARCHIVE,
    APPLICATION,
    AUDIO,
    IMAGE,
    TEXT,
    VIDEO,
    DOCUMENTATION,
    SPDX,
    OTHER;

    /**
     * Looks up a file type by its SPDX JSON name.
     *
     * @param value raw value from the document
     * @return matching type, or empty if unknown
     */
    public static Optional<FileType> fromSpdxName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(type -> type.name().equals(value))
            .findFirst();
    }
}
