package com.sbomcheck.core.model;

/**
 * An SPDX element carrying an {@code SPDXID}: the document, a package, a file or a snippet.
 */
public interface SpdxElement extends SpdxEntity {

    /**
     * Returns the SPDX identifier of this element.
     *
     * @return SPDXID, or null if missing from the source document
     */
    String spdxId();

    @Override
    default String entityId() {
        return spdxId();
    }
}
