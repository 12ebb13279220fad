package com.sbomcheck.core.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A JSON document on disk.
 */
public final class FileDocumentSource implements DocumentSource {

    private static final Logger log = LoggerFactory.getLogger(FileDocumentSource.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final Path path;
    private final String documentId;

    public FileDocumentSource(Path path, String documentId) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.documentId = Objects.requireNonNull(documentId, "documentId must not be null");
    }

    public FileDocumentSource(Path path) {
        this(path, path.getFileName().toString());
    }

    public Path path() {
        return path;
    }

    @Override
    public String documentId() {
        return documentId;
    }

    @Override
    public JsonNode load() throws DocumentLoadException {
        log.debug("Parsing {}", path);
        try {
            JsonNode root = MAPPER.readTree(path.toFile());
            if (root == null || root.isMissingNode()) {
                throw new DocumentLoadException("File " + path + " is empty");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new DocumentLoadException("File " + path + " is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DocumentLoadException("File " + path + " could not be read: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
