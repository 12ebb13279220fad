package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.SpdxSnippet;
import com.sbomcheck.core.rule.Rule;
import com.sbomcheck.core.rule.RuleProvider;

import java.util.List;

/**
 * SPDX 2.3 clause 9: snippet information.
 */
public class SnippetRuleProvider implements RuleProvider {

    private static final EntityType SNIPPET = EntityType.SNIPPET;

    private final List<Rule> rules = List.of(
        new MandatoryFieldRule<>("SPDX-9.1", SNIPPET, SpdxSnippet.class, "SPDXID", SpdxSnippet::spdxId),
        ValueFormatRule.single("SPDX-9.1", SNIPPET, SpdxSnippet.class, "SPDXID",
            SpdxSnippet::spdxId, SpdxFormats::isElementId, "SPDXRef-[idstring]"),
        new MandatoryFieldRule<>("SPDX-9.2", SNIPPET, SpdxSnippet.class, "snippetFromFile",
            SpdxSnippet::snippetFromFile),
        new ReferenceRule<>(SNIPPET, SpdxSnippet.class, "snippetFromFile",
            snippet -> snippet.snippetFromFile() == null ? List.of() : List.of(snippet.snippetFromFile()),
            EntityType.FILE, false),
        new SnippetRangeRule(),
        LicenseExpressionRule.expression(SNIPPET, SpdxSnippet.class, "licenseConcluded",
            SpdxSnippet::licenseConcluded),
        LicenseRefResolutionRule.of(SNIPPET, SpdxSnippet.class, "licenseConcluded", SpdxSnippet::licenseConcluded),
        LicenseExpressionRule.identifierList(SNIPPET, SpdxSnippet.class, "licenseInfoInSnippets",
            SpdxSnippet::licenseInfoInSnippets),
        new LicenseRefResolutionRule<>(SNIPPET, SpdxSnippet.class, "licenseInfoInSnippets",
            SpdxSnippet::licenseInfoInSnippets)
    );

    @Override
    public String getId() {
        return "spdx-snippet";
    }

    @Override
    public String getSpdxVersion() {
        return SpdxFormats.SPDX_VERSION;
    }

    @Override
    public int getPriority() {
        return 40;
    }

    @Override
    public List<Rule> getRules() {
        return rules;
    }
}
