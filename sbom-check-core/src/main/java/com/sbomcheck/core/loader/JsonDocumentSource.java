package com.sbomcheck.core.loader;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A document that is already parsed, for callers that obtain SPDX JSON elsewhere.
 *
 * @param documentId document identifier
 * @param root parsed JSON value
 */
public record JsonDocumentSource(String documentId, JsonNode root) implements DocumentSource {

    /**
     * Compact constructor with validation.
     */
    public JsonDocumentSource {
        Objects.requireNonNull(documentId, "documentId must not be null");
        Objects.requireNonNull(root, "root must not be null");
    }

    @Override
    public JsonNode load() {
        return root;
    }
}
