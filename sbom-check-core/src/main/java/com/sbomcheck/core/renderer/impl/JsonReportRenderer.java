package com.sbomcheck.core.renderer.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sbomcheck.core.renderer.RenderContext;
import com.sbomcheck.core.renderer.ReportRenderer;
import com.sbomcheck.core.report.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renderer that writes the run summary as JSON.
 *
 * <p>The output shape is {@code {status, documents: [{documentId, status, violations, error?}]}}
 * with documents in submission order.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code json.file} - Target file, resolved against the output directory
 *       (default: "results.json")</li>
 * </ul>
 */
public class JsonReportRenderer implements ReportRenderer {

    private static final Logger logger = LoggerFactory.getLogger(JsonReportRenderer.class);

    public static final String DEFAULT_FILE_NAME = "results.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getDescription() {
        return "Writes the run summary to " + DEFAULT_FILE_NAME;
    }

    @Override
    public void render(RunSummary summary, RenderContext context) {
        Path target = context.outputPath()
            .resolve(context.getSettingOrDefault("json.file", DEFAULT_FILE_NAME));
        logger.info("Writing JSON results to: {}", target);

        try {
            Path parentDir = target.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(target, toJson(summary));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write JSON results: " + target, e);
        }
    }

    /**
     * Serializes a run summary.
     *
     * @param summary run summary
     * @return indented JSON
     * @throws IOException if serialization fails
     */
    public String toJson(RunSummary summary) throws IOException {
        return MAPPER.writeValueAsString(summary) + System.lineSeparator();
    }
}
