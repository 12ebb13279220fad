package com.sbomcheck.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of entities a rule can target within an SPDX document.
 *
 * <p>The label is the name used in policy configuration files (e.g. {@code Package}).
 */
public enum EntityType {
    /** The document itself, including its creation information */
    DOCUMENT("Document"),

    /** A package entry from the {@code packages} array */
    PACKAGE("Package"),

    /** A file entry from the {@code files} array */
    FILE("File"),

    /** A snippet entry from the {@code snippets} array */
    SNIPPET("Snippet"),

    /** A custom license from the {@code hasExtractedLicensingInfos} array */
    EXTRACTED_LICENSING_INFO("ExtractedLicensingInfo"),

    /** A relationship from the {@code relationships} array */
    RELATIONSHIP("Relationship");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    /**
     * Returns the configuration label of this entity type.
     *
     * @return label such as {@code Package} or {@code File}
     */
    public String label() {
        return label;
    }

    /**
     * Looks up an entity type by its configuration label.
     *
     * @param label label to look up (case-sensitive)
     * @return matching entity type, or empty if unknown
     */
    public static Optional<EntityType> fromLabel(String label) {
        return Arrays.stream(values())
            .filter(type -> type.label.equals(label))
            .findFirst();
    }
}
