package com.sbomcheck.core.rule.policy;

import com.sbomcheck.core.config.PolicyCheck;
import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.SpdxDocument;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.Violation;
import com.sbomcheck.core.rule.AbstractRule;
import com.sbomcheck.core.rule.RuleContext;

import java.util.List;

/**
 * The document describes exactly one element, and it is the first entry of {@code packages}.
 *
 * <p>Documents without packages pass; a {@code minItems} check on {@code packages} covers them.
 */
public class DescribesFirstPackageRule extends AbstractRule<SpdxDocument> {

    private final PolicyCheck check;

    public DescribesFirstPackageRule(PolicyCheck check) {
        super(PolicyRuleSet.code(EntityType.DOCUMENT, check),
            "Document describes its first package and nothing else",
            Severity.WARNING, SpdxDocument.class, EntityType.DOCUMENT);
        this.check = check;
    }

    @Override
    protected void check(SpdxDocument document, RuleContext context, List<Violation> violations) {
        if (document.packages().isEmpty()) {
            return;
        }
        List<String> described = context.index().describedIds();
        String firstPackageId = document.packages().get(0).spdxId();

        String problem = null;
        if (described.size() != 1) {
            problem = "The document must describe exactly one top-level package but describes "
                + described.size() + " element(s).";
        } else if (!described.get(0).equals(firstPackageId)) {
            problem = "The DESCRIBES relationship points to '" + described.get(0)
                + "' instead of the first package '" + firstPackageId + "'.";
        }
        if (problem != null) {
            String message = check.message() != null && !check.message().isBlank() ? check.message() : problem;
            violations.add(violation(context, document, check.fieldPath(), message));
        }
    }
}
