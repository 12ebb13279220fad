package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.FileType;
import com.sbomcheck.core.model.SpdxFile;
import com.sbomcheck.core.rule.Rule;
import com.sbomcheck.core.rule.RuleProvider;

import java.util.List;

/**
 * SPDX 2.3 clause 8: file information.
 */
public class FileRuleProvider implements RuleProvider {

    private static final EntityType FILE = EntityType.FILE;

    private final List<Rule> rules = List.of(
        new MandatoryFieldRule<>("SPDX-8.1", FILE, SpdxFile.class, "fileName", SpdxFile::fileName),
        new MandatoryFieldRule<>("SPDX-8.2", FILE, SpdxFile.class, "SPDXID", SpdxFile::spdxId),
        ValueFormatRule.single("SPDX-8.2", FILE, SpdxFile.class, "SPDXID",
            SpdxFile::spdxId, SpdxFormats::isElementId, "SPDXRef-[idstring]"),
        new ValueFormatRule<>("SPDX-8.3", FILE, SpdxFile.class, "fileTypes", SpdxFile::fileTypes,
            value -> FileType.fromSpdxName(value).isPresent(), "one of the SPDX 2.3 file types"),
        new ChecksumRule<>("SPDX-8.4", FILE, SpdxFile.class, SpdxFile::checksums, true),
        LicenseExpressionRule.expression(FILE, SpdxFile.class, "licenseConcluded", SpdxFile::licenseConcluded),
        LicenseRefResolutionRule.of(FILE, SpdxFile.class, "licenseConcluded", SpdxFile::licenseConcluded),
        LicenseExpressionRule.identifierList(FILE, SpdxFile.class, "licenseInfoInFiles",
            SpdxFile::licenseInfoInFiles),
        new LicenseRefResolutionRule<>(FILE, SpdxFile.class, "licenseInfoInFiles", SpdxFile::licenseInfoInFiles)
    );

    @Override
    public String getId() {
        return "spdx-file";
    }

    @Override
    public String getSpdxVersion() {
        return SpdxFormats.SPDX_VERSION;
    }

    @Override
    public int getPriority() {
        return 30;
    }

    @Override
    public List<Rule> getRules() {
        return rules;
    }
}
