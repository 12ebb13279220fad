package com.sbomcheck.core.renderer.impl;

import com.sbomcheck.core.renderer.RenderContext;
import com.sbomcheck.core.renderer.ReportRenderer;
import com.sbomcheck.core.report.RunStatus;
import com.sbomcheck.core.report.RunSummary;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.ValidationReport;
import com.sbomcheck.core.report.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;

/**
 * Renderer that prints the run summary to the console with optional ANSI color formatting.
 *
 * <p>Output is grouped by document. Within a document, errors come before warnings and
 * each group keeps report order.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "true")</li>
 *   <li>{@code console.showPassing} - List compliant documents ("true"/"false", default: "true")</li>
 * </ul>
 *
 * <p><b>Example Output:</b>
 * <pre>
 * bad.spdx.json successfully parsed, but was not compliant with validation standards.
 * The following validation issues were found:
 *
 * * [error] SPDX-6.2: dataLicense is mandatory
 *     entity: SPDXRef-DOCUMENT, field: dataLicense
 * </pre>
 */
public class ConsoleReportRenderer implements ReportRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleReportRenderer.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public String getDescription() {
        return "Prints per-document results to standard output";
    }

    @Override
    public void render(RunSummary summary, RenderContext context) {
        boolean useColors = context.isEnabled("console.colors", true);
        boolean showPassing = context.isEnabled("console.showPassing", true);
        PrintStream out = System.out;

        logger.debug("Rendering {} document(s) to console (colors: {})", summary.documents().size(), useColors);

        for (ValidationReport report : summary.documents()) {
            switch (report.status()) {
                case PASS -> {
                    if (showPassing) {
                        out.println();
                        out.println(color(useColors, ANSI_GREEN) + report.documentId() + " is compliant."
                            + reset(useColors));
                    }
                }
                case UNREADABLE -> printUnreadable(out, report, useColors);
                case SKIPPED -> {
                    out.println();
                    out.println(color(useColors, ANSI_YELLOW) + report.documentId()
                        + " was not validated: " + report.loadError() + reset(useColors));
                }
                case FAIL -> printViolations(out, report, useColors);
            }
        }

        printSummary(out, summary, useColors);
    }

    private void printUnreadable(PrintStream out, ValidationReport report, boolean useColors) {
        out.println();
        out.println(color(useColors, ANSI_BOLD + ANSI_RED) + report.documentId()
            + " is not compliant, as it could not be parsed." + reset(useColors));
        out.println("The following errors were found:");
        out.println();
        out.println("* " + report.loadError());
    }

    private void printViolations(PrintStream out, ValidationReport report, boolean useColors) {
        out.println();
        out.println(color(useColors, ANSI_BOLD + ANSI_RED) + report.documentId()
            + " successfully parsed, but was not compliant with validation standards." + reset(useColors));
        out.println("The following validation issues were found:");

        // Most severe first
        Severity[] severities = Severity.values();
        for (int i = severities.length - 1; i >= 0; i--) {
            List<Violation> group = report.violationsWithSeverity(severities[i]);
            for (Violation violation : group) {
                printViolation(out, violation, useColors);
            }
        }
    }

    private void printViolation(PrintStream out, Violation violation, boolean useColors) {
        String severityColor = violation.severity() == Severity.ERROR ? ANSI_RED : ANSI_YELLOW;
        out.println();
        out.println("* " + color(useColors, severityColor) + "[" + violation.severity().jsonName() + "]"
            + reset(useColors) + " " + violation.ruleCode() + ": " + violation.message());

        String entity = violation.entitySpdxId() == null ? "-" : violation.entitySpdxId();
        String field = violation.fieldPath().isEmpty() ? "-" : violation.fieldPath();
        out.println("    entity: " + entity + ", field: " + field);
    }

    private void printSummary(PrintStream out, RunSummary summary, boolean useColors) {
        long failing = summary.documents().stream().filter(report -> !report.isPassing()).count();
        boolean passed = summary.status() == RunStatus.PASS;

        out.println();
        out.println(color(useColors, ANSI_BOLD + (passed ? ANSI_GREEN : ANSI_RED))
            + (passed ? "PASS" : "FAIL") + ": " + summary.documents().size() + " document(s), "
            + failing + " not compliant, " + summary.violationCount() + " violation(s)"
            + reset(useColors));
    }

    private static String color(boolean useColors, String code) {
        return useColors ? code : "";
    }

    private static String reset(boolean useColors) {
        return useColors ? ANSI_RESET : "";
    }
}
