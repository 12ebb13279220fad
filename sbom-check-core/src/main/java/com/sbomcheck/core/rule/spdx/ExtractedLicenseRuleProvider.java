package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.ExtractedLicensingInfo;
import com.sbomcheck.core.rule.Rule;
import com.sbomcheck.core.rule.RuleProvider;

import java.util.List;

/**
 * SPDX 2.3 clause 10: licenses not on the SPDX license list.
 */
public class ExtractedLicenseRuleProvider implements RuleProvider {

    private static final EntityType LICENSE = EntityType.EXTRACTED_LICENSING_INFO;

    private final List<Rule> rules = List.of(
        new MandatoryFieldRule<>("SPDX-10.1", LICENSE, ExtractedLicensingInfo.class, "licenseId",
            ExtractedLicensingInfo::licenseId),
        ValueFormatRule.single("SPDX-10.1", LICENSE, ExtractedLicensingInfo.class, "licenseId",
            ExtractedLicensingInfo::licenseId, SpdxFormats::isLicenseRef, "LicenseRef-[idstring]"),
        new MandatoryFieldRule<>("SPDX-10.2", LICENSE, ExtractedLicensingInfo.class, "extractedText",
            ExtractedLicensingInfo::extractedText)
    );

    @Override
    public String getId() {
        return "spdx-extracted-license";
    }

    @Override
    public String getSpdxVersion() {
        return SpdxFormats.SPDX_VERSION;
    }

    @Override
    public int getPriority() {
        return 50;
    }

    @Override
    public List<Rule> getRules() {
        return rules;
    }
}
