package com.sbomcheck.core.renderer;

import com.sbomcheck.core.report.RunSummary;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.ValidationReport;
import com.sbomcheck.core.report.Violation;

import java.util.List;

/**
 * Run summaries shared by renderer tests.
 */
public final class ReportFixtures {

    private ReportFixtures() {
    }

    public static Violation violation(String documentId, String code, Severity severity, String fieldPath) {
        return new Violation(documentId, code, severity, "SPDXRef-DOCUMENT", fieldPath, code + " failed");
    }

    /**
     * One passing, one failing (a warning reported before an error) and one unreadable document.
     */
    public static RunSummary mixedRun() {
        return RunSummary.of(List.of(
            ValidationReport.evaluated("good.spdx.json", List.of()),
            ValidationReport.evaluated("nested/bad.spdx.json", List.of(
                violation("nested/bad.spdx.json", "POLICY:Document.name:required", Severity.WARNING, "name"),
                violation("nested/bad.spdx.json", "SPDX-6.2", Severity.ERROR, "dataLicense"))),
            ValidationReport.unreadable("broken.spdx.json", "File broken.spdx.json is not valid JSON: oops")
        ));
    }
}
