package com.sbomcheck.core.model;

/**
 * Reference to another SPDX document, declared so that its elements can be
 * referenced as {@code DocumentRef-<id>:SPDXRef-<element>}.
 *
 * @param externalDocumentId identifier of the form {@code DocumentRef-...}
 * @param spdxDocument namespace URI of the referenced document
 * @param checksum SHA1 checksum of the referenced document
 */
public record ExternalDocumentRef(
    String externalDocumentId,
    String spdxDocument,
    Checksum checksum
) {}
