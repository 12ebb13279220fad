package com.sbomcheck.core.resolver;

import com.sbomcheck.core.model.SpdxDocument;

import java.util.Objects;

/**
 * A bound document together with its identifier index; the input of every rule.
 *
 * @param documentId identifier of the source (usually the file name)
 * @param document bound document model
 * @param index identifier index built over the document
 */
public record ResolvedDocument(
    String documentId,
    SpdxDocument document,
    ReferenceIndex index
) {
    /**
     * Compact constructor with validation.
     */
    public ResolvedDocument {
        Objects.requireNonNull(documentId, "documentId must not be null");
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(index, "index must not be null");
    }
}
