package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.model.ChecksumAlgorithm;
import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.ExternalDocumentRef;
import com.sbomcheck.core.model.SpdxDocument;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.Violation;
import com.sbomcheck.core.rule.AbstractRule;
import com.sbomcheck.core.rule.RuleContext;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks external document references: a unique {@code DocumentRef-} id, the namespace URI of
 * the other document and its SHA1 checksum.
 */
public class ExternalDocumentRefRule extends AbstractRule<SpdxDocument> {

    private static final String FIELD = "externalDocumentRefs";

    public ExternalDocumentRefRule() {
        super("SPDX-6.6", "External document references are complete and well-formed",
            Severity.ERROR, SpdxDocument.class, EntityType.DOCUMENT);
    }

    @Override
    protected void check(SpdxDocument document, RuleContext context, List<Violation> violations) {
        if (context.isUnbound(document, FIELD)) {
            return;
        }
        Set<String> seen = new HashSet<>();
        for (ExternalDocumentRef ref : document.externalDocumentRefs()) {
            String id = ref.externalDocumentId();
            if (id == null) {
                violations.add(violation(context, document, FIELD + ".externalDocumentId", "externalDocumentId is mandatory"));
            } else if (!SpdxFormats.isDocumentRef(id)) {
                violations.add(violation(context, document, FIELD + ".externalDocumentId",
                    "externalDocumentId must match DocumentRef-[idstring] but was '" + id + "'"));
            } else if (!seen.add(id)) {
                violations.add(violation(context, document, FIELD + ".externalDocumentId",
                    "'" + id + "' is declared more than once"));
            }

            if (ref.spdxDocument() == null) {
                violations.add(violation(context, document, FIELD + ".spdxDocument", "spdxDocument is mandatory"));
            } else if (!SpdxFormats.isNamespace(ref.spdxDocument())) {
                violations.add(violation(context, document, FIELD + ".spdxDocument",
                    "spdxDocument must be an absolute URI without '#' but was '" + ref.spdxDocument() + "'"));
            }

            if (ref.checksum() == null) {
                violations.add(violation(context, document, FIELD + ".checksum", "checksum is mandatory"));
            } else if (!ChecksumAlgorithm.SHA1.spdxName().equals(ref.checksum().algorithm())
                    || ref.checksum().checksumValue() == null
                    || !SpdxFormats.isSha1Hex(ref.checksum().checksumValue())) {
                violations.add(violation(context, document, FIELD + ".checksum",
                    "checksum must be a SHA1 digest of 40 hex characters"));
            }
        }
    }
}
