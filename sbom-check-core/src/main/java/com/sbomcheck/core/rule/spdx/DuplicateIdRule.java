package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.ExtractedLicensingInfo;
import com.sbomcheck.core.model.SpdxEntity;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.Violation;
import com.sbomcheck.core.resolver.DuplicateIdentifier;
import com.sbomcheck.core.rule.AbstractRule;
import com.sbomcheck.core.rule.RuleContext;

import java.util.List;

/**
 * Flags every declaration of an SPDXID or LicenseRef id after the first one.
 *
 * <p>The first declaration stays canonical, so one duplicate yields exactly one violation.
 */
public class DuplicateIdRule extends AbstractRule<SpdxEntity> {

    public static final String CODE = "SPDX-DUPLICATE-ID";

    public DuplicateIdRule() {
        super(CODE, "SPDXIDs and LicenseRef ids are unique within the document", Severity.ERROR,
            SpdxEntity.class, EntityType.PACKAGE,
            EntityType.FILE, EntityType.SNIPPET, EntityType.EXTRACTED_LICENSING_INFO);
    }

    @Override
    protected void check(SpdxEntity entity, RuleContext context, List<Violation> violations) {
        for (DuplicateIdentifier duplicate : context.index().duplicateIds()) {
            if (duplicate.duplicate() != entity) {
                continue;
            }
            String field = entity instanceof ExtractedLicensingInfo ? "licenseId" : "SPDXID";
            violations.add(violation(context, entity, field,
                "'" + duplicate.identifier() + "' is already declared by a "
                    + duplicate.canonical().entityType().label()));
        }
    }
}
