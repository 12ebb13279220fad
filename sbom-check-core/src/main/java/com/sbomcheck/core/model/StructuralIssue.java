package com.sbomcheck.core.model;

import java.util.Objects;

/**
 * A field that could not be bound into the document model because its JSON type was wrong.
 *
 * <p>An issue with an empty field path refers to the whole document (for example a
 * top-level JSON array instead of an object) and covers every field beneath it.
 *
 * <p>The location names the entity the field belongs to by position, {@code packages[1]}
 * for the second bound package or {@link #DOCUMENT_LOCATION} for the document, so that
 * entities sharing an SPDXID never hide each other's fields.
 *
 * @param entityId id of the entity the field belongs to, may be null
 * @param location position of the owning entity in the model lists
 * @param fieldPath dotted path of the offending field as reported, empty for the document root
 * @param localPath dotted path of the field relative to the owning entity
 * @param message human-readable description
 */
public record StructuralIssue(
    String entityId,
    String location,
    String fieldPath,
    String localPath,
    String message
) {
    public static final String ROOT_PATH = "";
    public static final String DOCUMENT_LOCATION = "";

    /**
     * Compact constructor with validation.
     */
    public StructuralIssue {
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(fieldPath, "fieldPath must not be null");
        Objects.requireNonNull(localPath, "localPath must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Creates an issue that rejects the whole document.
     *
     * @param message description of why the document cannot be bound
     * @return root issue
     */
    public static StructuralIssue root(String message) {
        return new StructuralIssue(null, DOCUMENT_LOCATION, ROOT_PATH, ROOT_PATH, message);
    }

    /**
     * Returns true if this issue rejects the whole document.
     *
     * @return true for a root issue
     */
    public boolean isRoot() {
        return ROOT_PATH.equals(fieldPath);
    }

    /**
     * Returns true if this issue covers the given field of the entity at the given location.
     *
     * @param otherLocation location of the entity to test
     * @param otherLocalPath field path relative to that entity
     * @return true if the field, or one of its parents, failed to bind
     */
    public boolean covers(String otherLocation, String otherLocalPath) {
        if (isRoot()) {
            return true;
        }
        if (!location.equals(otherLocation)) {
            return false;
        }
        return otherLocalPath.equals(localPath) || otherLocalPath.startsWith(localPath + ".");
    }
}
