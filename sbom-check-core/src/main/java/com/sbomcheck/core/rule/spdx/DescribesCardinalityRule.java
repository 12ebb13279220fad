package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.SpdxDocument;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.Violation;
import com.sbomcheck.core.rule.AbstractRule;
import com.sbomcheck.core.rule.RuleContext;

import java.util.List;

/**
 * The document describes exactly one element, through a {@code DESCRIBES} or
 * {@code DESCRIBED_BY} relationship or the legacy {@code documentDescribes} list.
 */
public class DescribesCardinalityRule extends AbstractRule<SpdxDocument> {

    public static final String CODE = "SPDX-DESCRIBES";

    public DescribesCardinalityRule() {
        super(CODE, "The document describes exactly one element", Severity.ERROR,
            SpdxDocument.class, EntityType.DOCUMENT);
    }

    @Override
    protected void check(SpdxDocument document, RuleContext context, List<Violation> violations) {
        List<String> described = context.index().describedIds();
        if (described.isEmpty()) {
            violations.add(violation(context, document, "relationships",
                "there must be a relationship \"" + SpdxFormats.DOCUMENT_SPDX_ID + " DESCRIBES ...\" or \"... DESCRIBED_BY "
                    + SpdxFormats.DOCUMENT_SPDX_ID + "\""));
        } else if (described.size() > 1) {
            violations.add(violation(context, document, "relationships",
                "the document must describe exactly one element but describes " + described));
        }
    }
}
