package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.SpdxEntity;
import com.sbomcheck.core.model.StructuralIssue;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.Violation;
import com.sbomcheck.core.rule.AbstractRule;
import com.sbomcheck.core.rule.RuleContext;

import java.util.List;

/**
 * Reports the fields the binder could not coerce to their SPDX JSON type.
 *
 * <p>This is the only rule evaluated on a rejected document.
 */
public class StructureRule extends AbstractRule<SpdxEntity> {

    public static final String CODE = "SPDX-STRUCTURE";

    public StructureRule() {
        super(CODE, "JSON values have the types SPDX 2.3 requires", Severity.ERROR, SpdxEntity.class,
            EntityType.DOCUMENT, EntityType.values());
    }

    @Override
    public boolean evaluatesRejectedDocuments() {
        return true;
    }

    @Override
    protected void check(SpdxEntity entity, RuleContext context, List<Violation> violations) {
        for (StructuralIssue issue : context.structuralIssuesOf(entity)) {
            violations.add(new Violation(
                context.documentId(), getCode(), getSeverity(), issue.entityId(), issue.fieldPath(), issue.message()));
        }
    }
}
