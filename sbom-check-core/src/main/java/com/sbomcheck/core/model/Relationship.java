package com.sbomcheck.core.model;

/**
 * Directed, typed edge between two SPDX elements.
 *
 * <p>The type is kept as the raw string so that values outside {@link RelationshipType}
 * can be reported rather than silently dropped.
 *
 * @param spdxElementId source element id
 * @param relationshipType raw relationship type, e.g. {@code DESCRIBES}
 * @param relatedSpdxElementId target element id, {@code NONE} or {@code NOASSERTION}
 * @param comment optional comment
 */
public record Relationship(
    String spdxElementId,
    String relationshipType,
    String relatedSpdxElementId,
    String comment
) implements SpdxEntity {

    @Override
    public EntityType entityType() {
        return EntityType.RELATIONSHIP;
    }

    @Override
    public String entityId() {
        return spdxElementId;
    }

    /**
     * Returns true if this relationship has the given type.
     *
     * @param type type to compare against
     * @return true if the raw type equals the enum name
     */
    public boolean hasType(RelationshipType type) {
        return type.name().equals(relationshipType);
    }
}
