package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.ExternalRef;
import com.sbomcheck.core.model.ExternalRefCategory;
import com.sbomcheck.core.model.SpdxPackage;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.Violation;
import com.sbomcheck.core.rule.AbstractRule;
import com.sbomcheck.core.rule.RuleContext;

import java.util.List;

/**
 * Checks package external references: known category, type present, locator present and
 * free of whitespace.
 */
public class ExternalRefRule extends AbstractRule<SpdxPackage> {

    private static final String FIELD = "externalRefs";

    public ExternalRefRule() {
        super("SPDX-7.21", "Package external references are complete and well-formed",
            Severity.ERROR, SpdxPackage.class, EntityType.PACKAGE);
    }

    @Override
    protected void check(SpdxPackage pkg, RuleContext context, List<Violation> violations) {
        if (context.isUnbound(pkg, FIELD)) {
            return;
        }
        for (ExternalRef ref : pkg.externalRefs()) {
            if (ref.referenceCategory() == null) {
                violations.add(violation(context, pkg, FIELD + ".referenceCategory", "referenceCategory is mandatory"));
            } else if (ExternalRefCategory.fromSpdxName(ref.referenceCategory()).isEmpty()) {
                violations.add(violation(context, pkg, FIELD + ".referenceCategory",
                    "referenceCategory must be SECURITY, PACKAGE-MANAGER, PERSISTENT-ID or OTHER but was '"
                        + ref.referenceCategory() + "'"));
            }
            if (ref.referenceType() == null || ref.referenceType().isBlank()) {
                violations.add(violation(context, pkg, FIELD + ".referenceType", "referenceType is mandatory"));
            }
            if (ref.referenceLocator() == null || ref.referenceLocator().isBlank()) {
                violations.add(violation(context, pkg, FIELD + ".referenceLocator", "referenceLocator is mandatory"));
            } else if (!SpdxFormats.hasNoWhitespace(ref.referenceLocator())) {
                violations.add(violation(context, pkg, FIELD + ".referenceLocator",
                    "referenceLocator must not contain whitespace but was '" + ref.referenceLocator() + "'"));
            }
        }
    }
}
