package com.sbomcheck.core.renderer.impl;

import com.sbomcheck.core.renderer.RenderContext;
import com.sbomcheck.core.renderer.ReportFixtures;
import com.sbomcheck.core.report.RunSummary;
import com.sbomcheck.core.report.ValidationReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleReportRenderer}.
 */
class ConsoleReportRendererTest {

    private static final RenderContext PLAIN = new RenderContext(".", Map.of("console.colors", "false"));

    private ConsoleReportRenderer renderer;
    private final PrintStream originalOut = System.out;
    private ByteArrayOutputStream outputStream;

    @BeforeEach
    void setUp() {
        renderer = new ConsoleReportRenderer();
        outputStream = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outputStream));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_mixedRun_describesEveryDocument() {
        // When
        renderer.render(ReportFixtures.mixedRun(), PLAIN);

        // Then
        String consoleOutput = outputStream.toString();
        assertThat(consoleOutput).contains("good.spdx.json is compliant.");
        assertThat(consoleOutput).contains(
            "nested/bad.spdx.json successfully parsed, but was not compliant with validation standards.");
        assertThat(consoleOutput).contains("* [error] SPDX-6.2: SPDX-6.2 failed");
        assertThat(consoleOutput).contains("    entity: SPDXRef-DOCUMENT, field: dataLicense");
        assertThat(consoleOutput).contains("broken.spdx.json is not compliant, as it could not be parsed.");
        assertThat(consoleOutput).contains("* File broken.spdx.json is not valid JSON: oops");
        assertThat(consoleOutput).contains("FAIL: 3 document(s), 2 not compliant, 2 violation(s)");
        assertThat(consoleOutput).doesNotContain("\u001B[");
    }

    @Test
    void render_listsErrorsBeforeWarnings() {
        renderer.render(ReportFixtures.mixedRun(), PLAIN);

        String consoleOutput = outputStream.toString();
        assertThat(consoleOutput.indexOf("[error] SPDX-6.2"))
            .isLessThan(consoleOutput.indexOf("[warning] POLICY:Document.name:required"));
    }

    @Test
    void render_hidePassing_omitsCompliantDocuments() {
        RenderContext context = new RenderContext(".", Map.of("console.colors", "false", "console.showPassing", "false"));

        renderer.render(ReportFixtures.mixedRun(), context);

        assertThat(outputStream.toString()).doesNotContain("good.spdx.json");
    }

    @Test
    void render_skippedDocument_saysItWasNotValidated() {
        RunSummary summary = RunSummary.of(List.of(ValidationReport.skipped("late.spdx.json")));

        renderer.render(summary, PLAIN);

        assertThat(outputStream.toString()).contains("late.spdx.json was not validated: validation cancelled");
    }

    @Test
    void render_allPassing_printsPassSummary() {
        RunSummary summary = RunSummary.of(List.of(ValidationReport.evaluated("good.spdx.json", List.of())));

        renderer.render(summary, PLAIN);

        assertThat(outputStream.toString()).contains("PASS: 1 document(s), 0 not compliant, 0 violation(s)");
    }

    @Test
    void render_withColors_emitsAnsiCodes() {
        renderer.render(ReportFixtures.mixedRun(), new RenderContext(".", Map.of()));

        assertThat(outputStream.toString()).contains("\u001B[");
    }
}
