package com.sbomcheck.core.model;

/**
 * Anything in an SPDX document that rules can be evaluated against.
 *
 * <p>Elements (document, packages, files, snippets) are identified by their SPDXID.
 * Relationships use their source element id and extracted licenses their LicenseRef id.
 */
public interface SpdxEntity {

    /**
     * Returns the kind of this entity.
     *
     * @return entity type
     */
    EntityType entityType();

    /**
     * Returns the identifier violations against this entity are reported under.
     *
     * @return identifier, may be null when the source document omitted it
     */
    String entityId();
}
