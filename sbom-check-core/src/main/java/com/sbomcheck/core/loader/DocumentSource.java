package com.sbomcheck.core.loader;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A document to validate, loaded on demand so that a run only holds as many parsed documents
 * in memory as it has workers.
 */
public interface DocumentSource {

    /**
     * Returns the identifier reports use for this document, usually its file name.
     *
     * @return document identifier
     */
    String documentId();

    /**
     * Reads and parses the document.
     *
     * @return parsed JSON value, of any JSON type
     * @throws DocumentLoadException if the document cannot be read or is not JSON
     */
    JsonNode load() throws DocumentLoadException;
}
