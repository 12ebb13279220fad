package com.sbomcheck.core.loader;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileDocumentSource}.
 */
class FileDocumentSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validJson_returnsTree() throws Exception {
        Path file = Files.writeString(tempDir.resolve("doc.spdx.json"), "{\"spdxVersion\": \"SPDX-2.3\"}");

        JsonNode root = new FileDocumentSource(file).load();

        assertThat(root.path("spdxVersion").asText()).isEqualTo("SPDX-2.3");
    }

    @Test
    void load_nonObjectJson_isReturnedAsIs() throws Exception {
        Path file = Files.writeString(tempDir.resolve("doc.spdx.json"), "[1, 2]");

        assertThat(new FileDocumentSource(file).load().isArray()).isTrue();
    }

    @Test
    void load_invalidJson_throws() throws IOException {
        Path file = Files.writeString(tempDir.resolve("doc.spdx.json"), "{ not json");

        assertThatThrownBy(() -> new FileDocumentSource(file).load())
            .isInstanceOf(DocumentLoadException.class)
            .hasMessageContaining("is not valid JSON");
    }

    @Test
    void load_trailingContent_throws() throws IOException {
        Path file = Files.writeString(tempDir.resolve("doc.spdx.json"), "{} {}");

        assertThatThrownBy(() -> new FileDocumentSource(file).load())
            .isInstanceOf(DocumentLoadException.class);
    }

    @Test
    void load_emptyFile_throws() throws IOException {
        Path file = Files.writeString(tempDir.resolve("doc.spdx.json"), "");

        assertThatThrownBy(() -> new FileDocumentSource(file).load())
            .isInstanceOf(DocumentLoadException.class);
    }

    @Test
    void documentId_defaultsToFileName() {
        assertThat(new FileDocumentSource(tempDir.resolve("doc.spdx.json")).documentId())
            .isEqualTo("doc.spdx.json");
    }
}
