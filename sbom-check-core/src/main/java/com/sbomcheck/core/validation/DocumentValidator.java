package com.sbomcheck.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.sbomcheck.core.loader.DocumentLoadException;
import com.sbomcheck.core.loader.DocumentSource;
import com.sbomcheck.core.model.SpdxDocument;
import com.sbomcheck.core.parser.SpdxJsonBinder;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.ValidationReport;
import com.sbomcheck.core.report.Violation;
import com.sbomcheck.core.resolver.ReferenceResolver;
import com.sbomcheck.core.resolver.ResolvedDocument;
import com.sbomcheck.core.rule.Rule;
import com.sbomcheck.core.rule.RuleContext;
import com.sbomcheck.core.rule.RuleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Validates a single document: load, bind, resolve, evaluate, report.
 *
 * <p>Never throws for a problem confined to the document. A load failure yields an unreadable
 * report; an unexpected runtime failure, or a stack overflow on pathological input, yields a
 * report with one {@value RuleEngine#ENGINE_ERROR} violation.
 */
public class DocumentValidator {

    private static final Logger log = LoggerFactory.getLogger(DocumentValidator.class);

    private final SpdxJsonBinder binder = new SpdxJsonBinder();
    private final ReferenceResolver resolver = new ReferenceResolver();
    private final RuleEngine engine = new RuleEngine();
    private final List<Rule> rules;

    /**
     * Creates a validator for a fixed rule list.
     *
     * @param rules specification rules first, then policy rules
     */
    public DocumentValidator(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Loads and validates a document.
     *
     * @param source document source
     * @return the document's report
     */
    public ValidationReport validate(DocumentSource source) {
        String documentId = source.documentId();
        try {
            return validate(documentId, source.load());
        } catch (DocumentLoadException e) {
            log.warn("Unreadable document {}: {}", documentId, e.getMessage());
            return ValidationReport.unreadable(documentId, e.getMessage());
        } catch (RuntimeException | StackOverflowError e) {
            log.error("Validation of {} failed unexpectedly", documentId, e);
            Violation failure = new Violation(documentId, RuleEngine.ENGINE_ERROR, Severity.ERROR, null, "",
                "validation failed unexpectedly: " + e);
            return ValidationReport.evaluated(documentId, List.of(failure));
        }
    }

    /**
     * Validates an already parsed document.
     *
     * @param documentId document identifier
     * @param root parsed JSON value
     * @return the document's report
     */
    public ValidationReport validate(String documentId, JsonNode root) {
        SpdxDocument document = binder.bind(root);
        log.debug("{}: {}", documentId, ValidationStage.LOADED);

        ResolvedDocument resolved = resolver.resolve(documentId, document);
        log.debug("{}: {}", documentId, ValidationStage.RESOLVED);

        List<Violation> violations = engine.evaluate(new RuleContext(resolved), rules);
        log.debug("{}: {} ({} violations)", documentId, ValidationStage.RULES_EVALUATED, violations.size());

        ValidationReport report = ValidationReport.evaluated(documentId, violations);
        log.debug("{}: {} ({})", documentId, ValidationStage.REPORTED, report.status());
        return report;
    }
}
