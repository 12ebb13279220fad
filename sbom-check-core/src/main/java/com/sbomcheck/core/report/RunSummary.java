package com.sbomcheck.core.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate of all document reports of one validation run.
 *
 * <p>Serializes to the stable shape
 * {@code {status, documents: [{documentId, status, violations: [...]}]}}.
 *
 * @param status fail if any document did not pass
 * @param documents reports in document submission order
 */
@JsonPropertyOrder({"status", "documents"})
public record RunSummary(
    RunStatus status,
    @JsonProperty("documents") List<ValidationReport> documents
) {
    /**
     * Compact constructor with validation.
     */
    public RunSummary {
        Objects.requireNonNull(status, "status must not be null");
        documents = documents == null ? List.of() : List.copyOf(documents);
    }

    /**
     * Builds a summary from per-document reports.
     *
     * @param reports reports in submission order
     * @return summary that passes only if every report passes
     */
    public static RunSummary of(List<ValidationReport> reports) {
        boolean allPassing = reports.stream().allMatch(ValidationReport::isPassing);
        return new RunSummary(allPassing ? RunStatus.PASS : RunStatus.FAIL, reports);
    }

    /**
     * Returns the process exit code for this run.
     *
     * <p>Unreadable and skipped documents always fail the run. Violations fail it only if
     * their severity meets the threshold, so {@link Severity#ERROR} ignores policy warnings.
     *
     * @param threshold minimum severity that fails the run
     * @return 0 on success, 1 on failure
     */
    public int exitCode(Severity threshold) {
        for (ValidationReport report : documents) {
            if (report.status() == DocumentStatus.UNREADABLE || report.status() == DocumentStatus.SKIPPED) {
                return 1;
            }
            boolean failing = report.violations().stream()
                .anyMatch(violation -> violation.severity().isAtLeast(threshold));
            if (failing) {
                return 1;
            }
        }
        return 0;
    }

    /**
     * Returns the total number of violations across all documents.
     *
     * @return violation count
     */
    @JsonIgnore
    public int violationCount() {
        return documents.stream().mapToInt(report -> report.violations().size()).sum();
    }
}
