package com.sbomcheck.core.rule;

import com.sbomcheck.core.model.SpdxDocument;
import com.sbomcheck.core.model.SpdxEntity;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates rules against every entity of a document.
 *
 * <p>Violations come out ordered by entity appearance (document, packages, files, snippets,
 * extracted licenses, relationships) and, for each entity, by rule order. A rule that throws
 * is reported as one {@value #ENGINE_ERROR} violation and evaluation carries on with the
 * remaining rules.
 */
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    public static final String ENGINE_ERROR = "ENGINE-ERROR";

    /**
     * Evaluates rules against a document.
     *
     * @param context context of the resolved document
     * @param rules rules in evaluation order
     * @return violations in entity appearance order, then rule order
     */
    public List<Violation> evaluate(RuleContext context, List<Rule> rules) {
        SpdxDocument document = context.document();
        boolean rejected = document.rejected();
        List<Violation> violations = new ArrayList<>();

        for (SpdxEntity entity : document.entities()) {
            for (Rule rule : rules) {
                if (rejected && !rule.evaluatesRejectedDocuments()) {
                    continue;
                }
                if (!rule.appliesTo(entity)) {
                    continue;
                }
                try {
                    violations.addAll(rule.evaluate(entity, context));
                } catch (RuntimeException e) {
                    log.error("Rule {} failed on {} in {}", rule.getCode(), entity.entityId(), context.documentId(), e);
                    violations.add(new Violation(
                        context.documentId(),
                        ENGINE_ERROR,
                        Severity.ERROR,
                        entity.entityId(),
                        "",
                        "rule " + rule.getCode() + " failed: " + e
                    ));
                }
            }
        }

        log.debug("Evaluated {} rules against {} entities of {}: {} violations",
            rules.size(), document.entities().size(), context.documentId(), violations.size());
        return violations;
    }
}
