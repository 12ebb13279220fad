package com.sbomcheck.core.renderer.impl;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.sbomcheck.core.renderer.RenderContext;
import com.sbomcheck.core.renderer.ReportRenderer;
import com.sbomcheck.core.report.RunSummary;
import com.sbomcheck.core.report.ValidationReport;
import com.sbomcheck.core.report.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Renderer that writes one exceptions file per non-compliant document.
 *
 * <p>Each file is named {@code <documentId>_exceptions.csv}, with path separators in the
 * document id replaced by underscores, and holds a header row followed by one row per
 * violation. An unreadable document gets a single {@value #LOAD_ERROR} row.
 * Compliant documents produce no file.
 */
public class CsvReportRenderer implements ReportRenderer {

    private static final Logger logger = LoggerFactory.getLogger(CsvReportRenderer.class);

    public static final String FILE_SUFFIX = "_exceptions.csv";
    public static final String LOAD_ERROR = "LOAD-ERROR";

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final CsvSchema SCHEMA = CSV_MAPPER.schemaFor(ExceptionRow.class).withHeader();

    /**
     * One CSV line.
     */
    @JsonPropertyOrder({"spdx_id", "rule_code", "severity", "field_path", "message"})
    public record ExceptionRow(
        @JsonProperty("spdx_id") String spdxId,
        @JsonProperty("rule_code") String ruleCode,
        @JsonProperty("severity") String severity,
        @JsonProperty("field_path") String fieldPath,
        @JsonProperty("message") String message
    ) {
        static ExceptionRow of(Violation violation) {
            return new ExceptionRow(
                violation.entitySpdxId() == null ? "" : violation.entitySpdxId(),
                violation.ruleCode(),
                violation.severity().jsonName(),
                violation.fieldPath(),
                violation.message().replace("\n", " ")
            );
        }
    }

    @Override
    public String getId() {
        return "csv";
    }

    @Override
    public String getDescription() {
        return "Writes <document>" + FILE_SUFFIX + " for every non-compliant document";
    }

    @Override
    public void render(RunSummary summary, RenderContext context) {
        Path outputDir = context.outputPath();
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        int written = 0;
        for (ValidationReport report : summary.documents()) {
            if (report.isPassing()) {
                continue;
            }
            writeReport(outputDir, report);
            written++;
        }
        logger.info("Wrote {} exceptions file(s) to: {}", written, outputDir);
    }

    /**
     * Returns the exceptions file name of a document.
     *
     * @param documentId document identifier
     * @return file name
     */
    public static String fileNameFor(String documentId) {
        return documentId.replace('/', '_').replace('\\', '_') + FILE_SUFFIX;
    }

    private void writeReport(Path outputDir, ValidationReport report) {
        Path target = outputDir.resolve(fileNameFor(report.documentId()));
        logger.debug("Writing file: {}", target);

        try {
            Files.writeString(target, CSV_MAPPER.writer(SCHEMA).writeValueAsString(rowsOf(report)));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + target, e);
        }
    }

    private static List<ExceptionRow> rowsOf(ValidationReport report) {
        List<ExceptionRow> rows = new ArrayList<>();
        if (report.loadError() != null) {
            rows.add(new ExceptionRow("", LOAD_ERROR, "", "", report.loadError().replace("\n", " ")));
        }
        for (Violation violation : report.violations()) {
            rows.add(ExceptionRow.of(violation));
        }
        return rows;
    }
}
