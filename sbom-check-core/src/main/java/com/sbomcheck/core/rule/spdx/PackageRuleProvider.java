package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.PrimaryPackagePurpose;
import com.sbomcheck.core.model.SpdxPackage;
import com.sbomcheck.core.rule.Rule;
import com.sbomcheck.core.rule.RuleProvider;

import java.util.List;

/**
 * SPDX 2.3 clause 7: package information.
 */
public class PackageRuleProvider implements RuleProvider {

    private static final EntityType PKG = EntityType.PACKAGE;
    private static final String TIMESTAMP = "a UTC timestamp YYYY-MM-DDThh:mm:ssZ";
    private static final String ACTOR = "'Person: ...', 'Organization: ...' or NOASSERTION";

    private final List<Rule> rules = List.of(
        new MandatoryFieldRule<>("SPDX-7.1", PKG, SpdxPackage.class, "name", SpdxPackage::name),
        new MandatoryFieldRule<>("SPDX-7.2", PKG, SpdxPackage.class, "SPDXID", SpdxPackage::spdxId),
        ValueFormatRule.single("SPDX-7.2", PKG, SpdxPackage.class, "SPDXID",
            SpdxPackage::spdxId, SpdxFormats::isElementId, "SPDXRef-[idstring]"),
        ValueFormatRule.single("SPDX-7.5", PKG, SpdxPackage.class, "supplier",
            SpdxPackage::supplier, SpdxFormats::isActorOrNoAssertion, ACTOR),
        ValueFormatRule.single("SPDX-7.6", PKG, SpdxPackage.class, "originator",
            SpdxPackage::originator, SpdxFormats::isActorOrNoAssertion, ACTOR),
        new MandatoryFieldRule<>("SPDX-7.7", PKG, SpdxPackage.class, "downloadLocation",
            SpdxPackage::downloadLocation),
        new FilesAnalyzedRule(),
        new MandatoryFieldRule<>("SPDX-7.9", PKG, SpdxPackage.class,
            "packageVerificationCode.packageVerificationCodeValue",
            pkg -> pkg.packageVerificationCode() == null ? null : pkg.packageVerificationCode().value(),
            pkg -> pkg.packageVerificationCode() != null),
        ValueFormatRule.single("SPDX-7.9", PKG, SpdxPackage.class,
            "packageVerificationCode.packageVerificationCodeValue",
            pkg -> pkg.packageVerificationCode() == null ? null : pkg.packageVerificationCode().value(),
            SpdxFormats::isSha1Hex, "40 hex characters"),
        new ChecksumRule<>("SPDX-7.10", PKG, SpdxPackage.class, SpdxPackage::checksums, false),
        LicenseExpressionRule.expression(PKG, SpdxPackage.class, "licenseConcluded",
            SpdxPackage::licenseConcluded),
        LicenseRefResolutionRule.of(PKG, SpdxPackage.class, "licenseConcluded", SpdxPackage::licenseConcluded),
        LicenseExpressionRule.identifierList(PKG, SpdxPackage.class, "licenseInfoFromFiles",
            SpdxPackage::licenseInfoFromFiles),
        new LicenseRefResolutionRule<>(PKG, SpdxPackage.class, "licenseInfoFromFiles",
            SpdxPackage::licenseInfoFromFiles),
        LicenseExpressionRule.expression(PKG, SpdxPackage.class, "licenseDeclared", SpdxPackage::licenseDeclared),
        LicenseRefResolutionRule.of(PKG, SpdxPackage.class, "licenseDeclared", SpdxPackage::licenseDeclared),
        new ExternalRefRule(),
        ValueFormatRule.single("SPDX-7.24", PKG, SpdxPackage.class, "primaryPackagePurpose",
            SpdxPackage::primaryPackagePurpose,
            value -> PrimaryPackagePurpose.fromSpdxName(value).isPresent(),
            "one of the SPDX 2.3 primary package purposes"),
        ValueFormatRule.single("SPDX-7.25", PKG, SpdxPackage.class, "releaseDate",
            SpdxPackage::releaseDate, SpdxFormats::isTimestamp, TIMESTAMP),
        ValueFormatRule.single("SPDX-7.26", PKG, SpdxPackage.class, "builtDate",
            SpdxPackage::builtDate, SpdxFormats::isTimestamp, TIMESTAMP),
        ValueFormatRule.single("SPDX-7.27", PKG, SpdxPackage.class, "validUntilDate",
            SpdxPackage::validUntilDate, SpdxFormats::isTimestamp, TIMESTAMP),
        new ReferenceRule<>(PKG, SpdxPackage.class, "hasFiles", SpdxPackage::hasFiles, EntityType.FILE, false)
    );

    @Override
    public String getId() {
        return "spdx-package";
    }

    @Override
    public String getSpdxVersion() {
        return SpdxFormats.SPDX_VERSION;
    }

    @Override
    public int getPriority() {
        return 20;
    }

    @Override
    public List<Rule> getRules() {
        return rules;
    }
}
