package com.sbomcheck.core.license;

import com.sbomcheck.parser.SpdxLicenseBaseVisitor;
import com.sbomcheck.parser.SpdxLicenseParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a parse tree and collects the identifiers of each kind.
 */
class IdentifierCollector extends SpdxLicenseBaseVisitor<Void> {

    static final String LICENSE_REF_PREFIX = "LicenseRef-";

    final List<String> licenseIds = new ArrayList<>();
    final List<String> licenseRefs = new ArrayList<>();
    final List<String> externalLicenseRefs = new ArrayList<>();
    final List<String> exceptionIds = new ArrayList<>();

    @Override
    public Void visitLicenseTerm(SpdxLicenseParser.LicenseTermContext ctx) {
        visitSimpleExpression(ctx.simpleExpression());
        if (ctx.exceptionId != null) {
            exceptionIds.add(ctx.exceptionId.getText());
        }
        return null;
    }

    @Override
    public Void visitSimpleExpression(SpdxLicenseParser.SimpleExpressionContext ctx) {
        String licenseId = ctx.licenseId.getText();
        if (ctx.documentRef != null) {
            externalLicenseRefs.add(ctx.documentRef.getText() + ":" + licenseId);
        } else if (licenseId.startsWith(LICENSE_REF_PREFIX)) {
            licenseRefs.add(licenseId);
        } else {
            licenseIds.add(licenseId);
        }
        return null;
    }
}
