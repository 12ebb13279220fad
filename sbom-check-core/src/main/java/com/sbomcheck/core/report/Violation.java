package com.sbomcheck.core.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A single rule failure within a document.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Violation violation = new Violation(
 *     "sbom.spdx.json",
 *     "SPDX-6.2",
 *     Severity.ERROR,
 *     "SPDXRef-DOCUMENT",
 *     "dataLicense",
 *     "dataLicense is mandatory"
 * );
 * }</pre>
 *
 * @param documentId document the violation belongs to
 * @param ruleCode stable code of the rule that failed
 * @param severity error for specification rules, warning for policy rules
 * @param entitySpdxId id of the offending entity, may be null if the entity has none
 * @param fieldPath dotted path of the offending field, empty for whole-entity checks
 * @param message human-readable description
 */
@JsonPropertyOrder({"ruleCode", "severity", "entitySpdxId", "fieldPath", "message"})
@JsonInclude(JsonInclude.Include.ALWAYS)
public record Violation(
    @JsonIgnore String documentId,
    String ruleCode,
    Severity severity,
    String entitySpdxId,
    String fieldPath,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public Violation {
        Objects.requireNonNull(documentId, "documentId must not be null");
        Objects.requireNonNull(ruleCode, "ruleCode must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (fieldPath == null) {
            fieldPath = "";
        }
    }
}
