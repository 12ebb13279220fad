package com.sbomcheck.core.rule.spdx;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sbomcheck.core.SpdxFixtures;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.Violation;
import com.sbomcheck.core.rule.RuleEngine;
import com.sbomcheck.core.rule.SpecificationRuleSet;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.sbomcheck.core.SpdxFixtures.FILE_ID;
import static com.sbomcheck.core.SpdxFixtures.PACKAGE_ID;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Behaviour of the specification rule set against targeted defects.
 *
 * <p>Each test breaks one thing in an otherwise conformant document and expects exactly
 * the violations that defect causes.
 */
class SpecificationRulesTest {

    private static SpecificationRuleSet ruleSet;

    @BeforeAll
    static void loadRules() {
        ruleSet = SpecificationRuleSet.load();
    }

    private static List<Violation> evaluate(ObjectNode json) {
        return new RuleEngine().evaluate(SpdxFixtures.context(json), ruleSet.getRules());
    }

    @Test
    void validDocument_hasNoViolations() {
        assertThat(evaluate(SpdxFixtures.valid())).isEmpty();
    }

    @Test
    void evaluate_isIdempotent() {
        ObjectNode json = SpdxFixtures.valid();
        json.remove("dataLicense");
        SpdxFixtures.firstFile(json).remove("fileName");

        assertThat(evaluate(json)).isEqualTo(evaluate(json));
    }

    @Test
    void missingDataLicense_reportsMandatoryField() {
        ObjectNode json = SpdxFixtures.valid();
        json.remove("dataLicense");

        assertThat(evaluate(json)).singleElement().satisfies(violation -> {
            assertThat(violation.ruleCode()).isEqualTo("SPDX-6.2");
            assertThat(violation.severity()).isEqualTo(Severity.ERROR);
            assertThat(violation.entitySpdxId()).isEqualTo("SPDXRef-DOCUMENT");
            assertThat(violation.fieldPath()).isEqualTo("dataLicense");
            assertThat(violation.documentId()).isEqualTo("test.spdx.json");
        });
    }

    @Test
    void wrongDataLicense_reportsFormat() {
        ObjectNode json = SpdxFixtures.valid();
        json.put("dataLicense", "MIT");

        assertThat(evaluate(json)).singleElement().satisfies(violation -> {
            assertThat(violation.ruleCode()).isEqualTo("SPDX-6.2");
            assertThat(violation.message()).isEqualTo("dataLicense must be CC0-1.0 but was 'MIT'");
        });
    }

    @Test
    void unresolvedRelatedElement_reportsOneCrossReferenceViolation() {
        ObjectNode json = SpdxFixtures.valid();
        SpdxFixtures.addRelationship(json, PACKAGE_ID, "DEPENDS_ON", "SPDXRef-missing");

        assertThat(evaluate(json)).singleElement().satisfies(violation -> {
            assertThat(violation.ruleCode()).isEqualTo(ReferenceRule.CODE);
            assertThat(violation.entitySpdxId()).isEqualTo(PACKAGE_ID);
            assertThat(violation.fieldPath()).isEqualTo("relatedSpdxElementId");
            assertThat(violation.message()).contains("SPDXRef-missing");
        });
    }

    @Test
    void placeholderRelatedElement_isAllowed() {
        ObjectNode json = SpdxFixtures.valid();
        SpdxFixtures.addRelationship(json, PACKAGE_ID, "DEPENDS_ON", "NOASSERTION");
        SpdxFixtures.addRelationship(json, FILE_ID, "DEPENDS_ON", "NONE");

        assertThat(evaluate(json)).isEmpty();
    }

    @Test
    void undeclaredExternalDocument_isReported() {
        ObjectNode json = SpdxFixtures.valid();
        SpdxFixtures.addRelationship(json, PACKAGE_ID, "DEPENDS_ON", "DocumentRef-base:SPDXRef-lib");

        assertThat(evaluate(json)).singleElement()
            .extracting(Violation::ruleCode).isEqualTo(ReferenceRule.CODE);

        json.putArray("externalDocumentRefs").addObject()
            .put("externalDocumentId", "DocumentRef-base")
            .put("spdxDocument", "https://example.com/spdxdocs/base")
            .putObject("checksum")
            .put("algorithm", "SHA1")
            .put("checksumValue", "d6a770ba38583ed4bb4525bd96e50461655d2758");

        assertThat(evaluate(json)).isEmpty();
    }

    @Test
    void duplicateId_reportsOnceAgainstLaterDeclaration() {
        ObjectNode json = SpdxFixtures.valid();
        SpdxFixtures.arrayField(json, "packages").addObject()
            .put("SPDXID", PACKAGE_ID)
            .put("name", "shadow")
            .put("downloadLocation", "NOASSERTION");

        List<Violation> violations = evaluate(json);

        assertThat(violations).singleElement().satisfies(violation -> {
            assertThat(violation.ruleCode()).isEqualTo(DuplicateIdRule.CODE);
            assertThat(violation.entitySpdxId()).isEqualTo(PACKAGE_ID);
            assertThat(violation.fieldPath()).isEqualTo("SPDXID");
        });
    }

    @Test
    void undeclaredLicenseRef_reportsOneViolation() {
        ObjectNode json = SpdxFixtures.valid();
        SpdxFixtures.firstPackage(json).put("licenseDeclared", "MIT AND LicenseRef-Foo");

        assertThat(evaluate(json)).singleElement().satisfies(violation -> {
            assertThat(violation.ruleCode()).isEqualTo(LicenseRefResolutionRule.CODE);
            assertThat(violation.fieldPath()).isEqualTo("licenseDeclared");
            assertThat(violation.message()).contains("LicenseRef-Foo");
        });
    }

    @Test
    void declaredLicenseRef_resolves() {
        ObjectNode json = SpdxFixtures.valid();
        SpdxFixtures.firstPackage(json).put("licenseDeclared", "LicenseRef-Foo");
        SpdxFixtures.addExtractedLicense(json, "LicenseRef-Foo");

        assertThat(evaluate(json)).isEmpty();
    }

    @Test
    void malformedLicenseExpression_reportsSyntaxOnly() {
        ObjectNode json = SpdxFixtures.valid();
        SpdxFixtures.firstPackage(json).put("licenseConcluded", "MIT AND (LicenseRef-Foo");

        assertThat(evaluate(json)).singleElement()
            .extracting(Violation::ruleCode).isEqualTo(LicenseExpressionRule.CODE);
    }

    @Test
    void compoundExpressionInLicenseInfoInFiles_isRejected() {
        ObjectNode json = SpdxFixtures.valid();
        SpdxFixtures.firstFile(json).putArray("licenseInfoInFiles").add("MIT OR Apache-2.0");

        assertThat(evaluate(json)).singleElement().satisfies(violation -> {
            assertThat(violation.ruleCode()).isEqualTo(LicenseExpressionRule.CODE);
            assertThat(violation.entitySpdxId()).isEqualTo(FILE_ID);
        });
    }

    @Test
    void fileWithoutSha1_reportsChecksum() {
        ObjectNode json = SpdxFixtures.valid();
        ObjectNode checksum = (ObjectNode) SpdxFixtures.firstFile(json).get("checksums").get(0);
        checksum.put("algorithm", "SHA256");
        checksum.put("checksumValue", "11b6d3ee554eedf79299905a98f9b9a04e498210b59f15094c916c91d150efcd");

        assertThat(evaluate(json)).singleElement().satisfies(violation -> {
            assertThat(violation.ruleCode()).isEqualTo("SPDX-8.4");
            assertThat(violation.message()).isEqualTo("a SHA1 checksum is mandatory");
        });
    }

    @Test
    void checksumOfWrongLength_isReported() {
        ObjectNode json = SpdxFixtures.valid();
        ObjectNode checksum = (ObjectNode) SpdxFixtures.firstPackage(json).get("checksums").get(0);
        checksum.put("checksumValue", "abc123");

        assertThat(evaluate(json)).singleElement().satisfies(violation -> {
            assertThat(violation.ruleCode()).isEqualTo("SPDX-7.10");
            assertThat(violation.fieldPath()).isEqualTo("checksums.checksumValue");
        });
    }

    @Test
    void missingDescribesRelationship_isReported() {
        ObjectNode json = SpdxFixtures.valid();
        SpdxFixtures.relationships(json).remove(0);

        assertThat(evaluate(json)).singleElement()
            .extracting(Violation::ruleCode).isEqualTo(DescribesCardinalityRule.CODE);
    }

    @Test
    void describedByRelationship_satisfiesDescribes() {
        ObjectNode json = SpdxFixtures.valid();
        SpdxFixtures.relationships(json).remove(0);
        SpdxFixtures.addRelationship(json, PACKAGE_ID, "DESCRIBED_BY", "SPDXRef-DOCUMENT");

        assertThat(evaluate(json)).isEmpty();
    }

    @Test
    void twoDescribedElements_isReported() {
        ObjectNode json = SpdxFixtures.valid();
        SpdxFixtures.addRelationship(json, "SPDXRef-DOCUMENT", "DESCRIBES", FILE_ID);

        assertThat(evaluate(json)).singleElement()
            .extracting(Violation::ruleCode).isEqualTo(DescribesCardinalityRule.CODE);
    }

    @Test
    void invalidCreatorAndTimestamp_areReported() {
        ObjectNode json = SpdxFixtures.valid();
        ObjectNode creationInfo = (ObjectNode) json.get("creationInfo");
        creationInfo.putArray("creators").add("somebody");
        creationInfo.put("created", "2024-01-15");

        assertThat(evaluate(json)).extracting(Violation::ruleCode).containsExactly("SPDX-6.8", "SPDX-6.9");
    }

    @Test
    void filesAnalyzedFalse_forbidsVerificationCode() {
        ObjectNode json = SpdxFixtures.valid();
        ObjectNode pkg = SpdxFixtures.firstPackage(json);
        pkg.put("filesAnalyzed", false);
        pkg.remove("licenseInfoFromFiles");
        pkg.remove("hasFiles");

        assertThat(evaluate(json)).singleElement().satisfies(violation -> {
            assertThat(violation.ruleCode()).isEqualTo("SPDX-7.8");
            assertThat(violation.fieldPath()).isEqualTo("packageVerificationCode");
        });
    }

    @Test
    void snippetWithReversedRange_isReported() {
        ObjectNode json = SpdxFixtures.valid();
        ObjectNode snippet = SpdxFixtures.arrayField(json, "snippets").addObject()
            .put("SPDXID", "SPDXRef-Snippet-1")
            .put("snippetFromFile", FILE_ID);
        ObjectNode range = snippet.putArray("ranges").addObject();
        range.putObject("startPointer").put("reference", FILE_ID).put("offset", 40);
        range.putObject("endPointer").put("reference", FILE_ID).put("offset", 10);

        assertThat(evaluate(json)).singleElement().satisfies(violation -> {
            assertThat(violation.ruleCode()).isEqualTo("SPDX-9.3");
            assertThat(violation.message()).isEqualTo("range start 40 is after end 10");
        });
    }

    @Test
    void wrongFieldType_reportsStructureOnly() {
        ObjectNode json = SpdxFixtures.valid();
        SpdxFixtures.firstPackage(json).put("name", 42);

        assertThat(evaluate(json)).singleElement().satisfies(violation -> {
            assertThat(violation.ruleCode()).isEqualTo(StructureRule.CODE);
            assertThat(violation.entitySpdxId()).isEqualTo(PACKAGE_ID);
            assertThat(violation.fieldPath()).isEqualTo("name");
        });
    }

    @Test
    void duplicatePackageIds_wrongTypeOnSecondDoesNotHideMissingNameOnFirst() {
        ObjectNode json = SpdxFixtures.valid();
        ObjectNode second = SpdxFixtures.firstPackage(json).deepCopy();
        second.put("name", 42);
        SpdxFixtures.arrayField(json, "packages").add(second);
        SpdxFixtures.firstPackage(json).remove("name");

        List<Violation> violations = evaluate(json);

        assertThat(violations).extracting(Violation::ruleCode)
            .contains("SPDX-7.1", StructureRule.CODE, DuplicateIdRule.CODE);
        assertThat(violations).filteredOn(violation -> violation.ruleCode().equals("SPDX-7.1"))
            .singleElement()
            .satisfies(violation -> {
                assertThat(violation.entitySpdxId()).isEqualTo(PACKAGE_ID);
                assertThat(violation.fieldPath()).isEqualTo("name");
            });
    }

    @Test
    void rejectedDocument_reportsOnlyStructure() {
        List<Violation> violations = new RuleEngine().evaluate(
            SpdxFixtures.context(SpdxFixtures.MAPPER.createArrayNode()), ruleSet.getRules());

        assertThat(violations).singleElement().satisfies(violation -> {
            assertThat(violation.ruleCode()).isEqualTo(StructureRule.CODE);
            assertThat(violation.fieldPath()).isEmpty();
        });
    }

    @Test
    void violations_followEntityAppearanceOrder() {
        ObjectNode json = SpdxFixtures.valid();
        SpdxFixtures.firstFile(json).remove("fileName");
        SpdxFixtures.firstPackage(json).remove("downloadLocation");
        json.remove("name");

        assertThat(evaluate(json)).extracting(Violation::ruleCode)
            .containsExactly("SPDX-6.4", "SPDX-7.7", "SPDX-8.1");
    }
}
