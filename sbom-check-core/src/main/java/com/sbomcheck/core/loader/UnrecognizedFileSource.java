package com.sbomcheck.core.loader;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;

/**
 * A file found during discovery whose name does not end in {@code .spdx.json}.
 *
 * <p>It is never read; loading always fails, so the file shows up as unreadable in the report.
 *
 * @param path file path
 * @param documentId document identifier
 */
public record UnrecognizedFileSource(Path path, String documentId) implements DocumentSource {

    @Override
    public JsonNode load() throws DocumentLoadException {
        throw new DocumentLoadException("File " + path + " not recognized. Please ensure your files are SPDX JSON "
            + "format and end with '" + SpdxFileDiscovery.SPDX_EXTENSION + "'.");
    }
}
