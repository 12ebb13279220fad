package com.sbomcheck.core.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Validation outcome for a single document.
 *
 * @param documentId identifier of the document (usually its file name)
 * @param status pass, fail, unreadable or skipped
 * @param violations violations in entity appearance order, then rule order
 * @param loadError reason the document could not be loaded, null otherwise
 */
@JsonPropertyOrder({"documentId", "status", "violations", "error"})
public record ValidationReport(
    String documentId,
    DocumentStatus status,
    List<Violation> violations,
    @JsonProperty("error") @JsonInclude(JsonInclude.Include.NON_NULL) String loadError
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationReport {
        Objects.requireNonNull(documentId, "documentId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    /**
     * Creates the report of an evaluated document; the status follows from the violations.
     *
     * @param documentId document identifier
     * @param violations all violations found
     * @return pass report if there are no violations, fail report otherwise
     */
    public static ValidationReport evaluated(String documentId, List<Violation> violations) {
        DocumentStatus status = violations.isEmpty() ? DocumentStatus.PASS : DocumentStatus.FAIL;
        return new ValidationReport(documentId, status, violations, null);
    }

    /**
     * Creates the report of a document that could not be loaded.
     *
     * @param documentId document identifier
     * @param loadError reason
     * @return unreadable report
     */
    public static ValidationReport unreadable(String documentId, String loadError) {
        return new ValidationReport(documentId, DocumentStatus.UNREADABLE, List.of(), loadError);
    }

    /**
     * Creates the report of a document the run never reached.
     *
     * @param documentId document identifier
     * @return skipped report
     */
    public static ValidationReport skipped(String documentId) {
        return new ValidationReport(documentId, DocumentStatus.SKIPPED, List.of(), "validation cancelled");
    }

    /**
     * Returns true if the document was evaluated and produced no violation.
     *
     * @return true for a passing report
     */
    @JsonIgnore
    public boolean isPassing() {
        return status == DocumentStatus.PASS;
    }

    /**
     * Returns the violations with the given severity, in report order.
     *
     * @param severity severity to filter on
     * @return matching violations
     */
    public List<Violation> violationsWithSeverity(Severity severity) {
        return violations.stream()
            .filter(violation -> violation.severity() == severity)
            .toList();
    }
}
