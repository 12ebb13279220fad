package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.model.CreationInfo;
import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.SpdxDocument;
import com.sbomcheck.core.rule.Rule;
import com.sbomcheck.core.rule.RuleProvider;

import java.util.List;
import java.util.function.Function;

/**
 * SPDX 2.3 clause 6: document creation information.
 */
public class DocumentRuleProvider implements RuleProvider {

    private static final EntityType DOC = EntityType.DOCUMENT;

    private final List<Rule> rules = List.of(
        new MandatoryFieldRule<>("SPDX-6.1", DOC, SpdxDocument.class, "spdxVersion", SpdxDocument::spdxVersion),
        ValueFormatRule.single("SPDX-6.1", DOC, SpdxDocument.class, "spdxVersion",
            SpdxDocument::spdxVersion, SpdxFormats.SPDX_VERSION::equals, SpdxFormats.SPDX_VERSION),
        new MandatoryFieldRule<>("SPDX-6.2", DOC, SpdxDocument.class, "dataLicense", SpdxDocument::dataLicense),
        ValueFormatRule.single("SPDX-6.2", DOC, SpdxDocument.class, "dataLicense",
            SpdxDocument::dataLicense, SpdxFormats.DATA_LICENSE::equals, SpdxFormats.DATA_LICENSE),
        new MandatoryFieldRule<>("SPDX-6.3", DOC, SpdxDocument.class, "SPDXID", SpdxDocument::spdxId),
        ValueFormatRule.single("SPDX-6.3", DOC, SpdxDocument.class, "SPDXID",
            SpdxDocument::spdxId, SpdxFormats.DOCUMENT_SPDX_ID::equals, SpdxFormats.DOCUMENT_SPDX_ID),
        new MandatoryFieldRule<>("SPDX-6.4", DOC, SpdxDocument.class, "name", SpdxDocument::name),
        new MandatoryFieldRule<>("SPDX-6.5", DOC, SpdxDocument.class, "documentNamespace",
            SpdxDocument::documentNamespace),
        ValueFormatRule.single("SPDX-6.5", DOC, SpdxDocument.class, "documentNamespace",
            SpdxDocument::documentNamespace, SpdxFormats::isNamespace, "an absolute URI without '#'"),
        new ExternalDocumentRefRule(),
        ValueFormatRule.single("SPDX-6.7", DOC, SpdxDocument.class, "creationInfo.licenseListVersion",
            creationInfo(CreationInfo::licenseListVersion), SpdxFormats::isLicenseListVersion, "of the form M.N"),
        new MandatoryFieldRule<>("SPDX-6.8", DOC, SpdxDocument.class, "creationInfo", SpdxDocument::creationInfo),
        new MandatoryFieldRule<>("SPDX-6.8", DOC, SpdxDocument.class, "creationInfo.creators",
            creationInfo(CreationInfo::creators), DocumentRuleProvider::hasCreationInfo),
        new ValueFormatRule<>("SPDX-6.8", DOC, SpdxDocument.class, "creationInfo.creators",
            document -> hasCreationInfo(document) ? document.creationInfo().creators() : List.of(),
            SpdxFormats::isCreator, "'Person: ...', 'Organization: ...' or 'Tool: ...'"),
        new MandatoryFieldRule<>("SPDX-6.9", DOC, SpdxDocument.class, "creationInfo.created",
            creationInfo(CreationInfo::created), DocumentRuleProvider::hasCreationInfo),
        ValueFormatRule.single("SPDX-6.9", DOC, SpdxDocument.class, "creationInfo.created",
            creationInfo(CreationInfo::created), SpdxFormats::isTimestamp, "a UTC timestamp YYYY-MM-DDThh:mm:ssZ"),
        new DescribesCardinalityRule(),
        new ReferenceRule<>(DOC, SpdxDocument.class, "documentDescribes",
            SpdxDocument::documentDescribes, null, false)
    );

    private static boolean hasCreationInfo(SpdxDocument document) {
        return document.creationInfo() != null;
    }

    private static <V> Function<SpdxDocument, V> creationInfo(Function<CreationInfo, V> accessor) {
        return document -> document.creationInfo() == null ? null : accessor.apply(document.creationInfo());
    }

    @Override
    public String getId() {
        return "spdx-document";
    }

    @Override
    public String getSpdxVersion() {
        return SpdxFormats.SPDX_VERSION;
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public List<Rule> getRules() {
        return rules;
    }
}
