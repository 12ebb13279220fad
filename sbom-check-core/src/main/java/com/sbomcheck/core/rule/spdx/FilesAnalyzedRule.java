package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.SpdxPackage;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.Violation;
import com.sbomcheck.core.rule.AbstractRule;
import com.sbomcheck.core.rule.RuleContext;

import java.util.List;

/**
 * A package declaring {@code filesAnalyzed: false} must not carry file-level results:
 * no verification code, no licenses from files and no contained files.
 */
public class FilesAnalyzedRule extends AbstractRule<SpdxPackage> {

    public FilesAnalyzedRule() {
        super("SPDX-7.8", "Packages with filesAnalyzed false carry no file analysis results",
            Severity.ERROR, SpdxPackage.class, EntityType.PACKAGE);
    }

    @Override
    protected void check(SpdxPackage pkg, RuleContext context, List<Violation> violations) {
        if (pkg.effectiveFilesAnalyzed()) {
            return;
        }
        if (pkg.packageVerificationCode() != null) {
            violations.add(forbidden(context, pkg, "packageVerificationCode"));
        }
        if (!pkg.licenseInfoFromFiles().isEmpty()) {
            violations.add(forbidden(context, pkg, "licenseInfoFromFiles"));
        }
        if (!pkg.hasFiles().isEmpty()) {
            violations.add(forbidden(context, pkg, "hasFiles"));
        }
    }

    private Violation forbidden(RuleContext context, SpdxPackage pkg, String field) {
        return violation(context, pkg, field, field + " must be omitted when filesAnalyzed is false");
    }
}
