package com.sbomcheck.core.rule.policy;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sbomcheck.core.SpdxFixtures;
import com.sbomcheck.core.config.PolicyConfig;
import com.sbomcheck.core.config.PolicyConfigLoader;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.Violation;
import com.sbomcheck.core.rule.RuleEngine;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.sbomcheck.core.SpdxFixtures.FILE_ID;
import static com.sbomcheck.core.SpdxFixtures.PACKAGE_ID;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PolicyRuleSet} and the policy rules it builds.
 */
class PolicyRuleSetTest {

    private static List<Violation> evaluate(PolicyConfig config, ObjectNode json) {
        return new RuleEngine().evaluate(SpdxFixtures.context(json), new PolicyRuleSet(config).getRules());
    }

    private static List<Violation> evaluateDefault(ObjectNode json) {
        return evaluate(PolicyConfigLoader.loadDefault(), json);
    }

    @Test
    void defaultPolicy_validDocument_hasNoViolations() {
        assertThat(evaluateDefault(SpdxFixtures.valid())).isEmpty();
    }

    @Test
    void emptyPolicy_hasNoRulesAndNoViolations() {
        ObjectNode json = SpdxFixtures.valid();
        json.remove("name");
        SpdxFixtures.firstPackage(json).put("supplier", "NOASSERTION");

        assertThat(new PolicyRuleSet(PolicyConfig.empty()).getRules()).isEmpty();
        assertThat(evaluate(PolicyConfig.empty(), json)).isEmpty();
    }

    @Test
    void placeholderSupplier_reportsWarningWithConfiguredMessage() {
        ObjectNode json = SpdxFixtures.valid();
        SpdxFixtures.firstPackage(json).put("supplier", "NOASSERTION");

        assertThat(evaluateDefault(json)).singleElement().satisfies(violation -> {
            assertThat(violation.ruleCode()).isEqualTo("POLICY:Package.supplier:nonPlaceholder");
            assertThat(violation.severity()).isEqualTo(Severity.WARNING);
            assertThat(violation.entitySpdxId()).isEqualTo(PACKAGE_ID);
            assertThat(violation.fieldPath()).isEqualTo("supplier");
            assertThat(violation.message()).isEqualTo("This package has no supplier populated.");
        });
    }

    @Test
    void missingLicenseListVersion_isReportedOnDocument() {
        ObjectNode json = SpdxFixtures.valid();
        ((ObjectNode) json.get("creationInfo")).remove("licenseListVersion");

        assertThat(evaluateDefault(json)).singleElement().satisfies(violation -> {
            assertThat(violation.ruleCode()).isEqualTo("POLICY:Document.creationInfo.licenseListVersion:required");
            assertThat(violation.entitySpdxId()).isEqualTo("SPDXRef-DOCUMENT");
        });
    }

    @Test
    void filesNotAnalyzed_failsOneOf() {
        ObjectNode json = SpdxFixtures.valid();
        SpdxFixtures.firstPackage(json).put("filesAnalyzed", false);

        assertThat(evaluateDefault(json)).singleElement()
            .extracting(Violation::ruleCode).isEqualTo("POLICY:Package.filesAnalyzed:oneOf");
    }

    @Test
    void copyrightRequired_onlyWhenLicensed() {
        ObjectNode json = SpdxFixtures.valid();
        ObjectNode pkg = SpdxFixtures.firstPackage(json);
        pkg.remove("copyrightText");
        pkg.put("licenseConcluded", "NOASSERTION");
        pkg.put("licenseDeclared", "NONE");

        assertThat(evaluateDefault(json)).isEmpty();

        pkg.put("licenseDeclared", "MIT");

        assertThat(evaluateDefault(json)).singleElement()
            .extracting(Violation::ruleCode).isEqualTo("POLICY:Package.copyrightText:required");
    }

    @Test
    void blankValue_countsAsMissing() {
        ObjectNode json = SpdxFixtures.valid();
        SpdxFixtures.firstFile(json).put("copyrightText", "  ");

        assertThat(evaluateDefault(json)).singleElement().satisfies(violation -> {
            assertThat(violation.ruleCode()).isEqualTo("POLICY:File.copyrightText:required");
            assertThat(violation.entitySpdxId()).isEqualTo(FILE_ID);
        });
    }

    @Test
    void noFiles_failsMinItems() {
        ObjectNode json = SpdxFixtures.valid();
        json.remove("files");
        SpdxFixtures.firstPackage(json).remove("hasFiles");

        assertThat(evaluateDefault(json)).singleElement().satisfies(violation -> {
            assertThat(violation.ruleCode()).isEqualTo("POLICY:Document.files:minItems");
            assertThat(violation.message()).isEqualTo("The Document contains no files.");
        });
    }

    @Test
    void noPackages_reportsOnlyMissingPackages() {
        ObjectNode json = SpdxFixtures.valid();
        json.remove("packages");
        json.remove("files");

        assertThat(evaluateDefault(json)).singleElement().satisfies(violation -> {
            assertThat(violation.ruleCode()).isEqualTo("POLICY:Document.packages:minItems");
            assertThat(violation.message()).isEqualTo("The Document contains no packages.");
        });
    }

    @Test
    void describesSecondPackage_failsDescribesFirstPackage() {
        ObjectNode json = SpdxFixtures.valid();
        SpdxFixtures.arrayField(json, "packages").insertObject(0)
            .put("SPDXID", "SPDXRef-Package-dependency")
            .put("name", "dependency")
            .put("supplier", "Organization: Upstream")
            .put("downloadLocation", "NOASSERTION");

        assertThat(evaluateDefault(json)).singleElement().satisfies(violation -> {
            assertThat(violation.ruleCode()).isEqualTo("POLICY:Document.relationships:describesFirstPackage");
            assertThat(violation.fieldPath()).isEqualTo("relationships");
            assertThat(violation.message()).contains("SPDXRef-Package-dependency");
        });
    }

    @Test
    void oneOf_fansOutOverArrays_andNamesOffendingValues() {
        PolicyConfig config = PolicyConfigLoader.parse("""
            Package:
              - fieldPath: checksums.algorithm
                check: oneOf
                allowedValues: [SHA1]
            """);

        assertThat(evaluate(config, SpdxFixtures.valid())).singleElement().satisfies(violation ->
            assertThat(violation.message())
                .isEqualTo("Package checksums.algorithm must be one of [SHA1] but was 'SHA256'"));
    }

    @Test
    void oneOf_absentField_passes() {
        PolicyConfig config = PolicyConfigLoader.parse("""
            Package:
              - fieldPath: originator
                check: oneOf
                allowedValues: ["Organization: Example Inc."]
            """);

        assertThat(evaluate(config, SpdxFixtures.valid())).isEmpty();
    }

    @Test
    void required_onRelationshipField_isEvaluatedPerRelationship() {
        PolicyConfig config = PolicyConfigLoader.parse("""
            Relationship:
              - fieldPath: comment
                check: required
            """);

        assertThat(evaluate(config, SpdxFixtures.valid()))
            .extracting(Violation::message)
            .containsExactly("Relationship comment is required", "Relationship comment is required");
    }

    @Test
    void unboundField_isLeftToStructureRule() {
        ObjectNode json = SpdxFixtures.valid();
        SpdxFixtures.firstPackage(json).put("supplier", 12);

        assertThat(evaluateDefault(json)).isEmpty();
    }

    @Test
    void ruleDescriptions_nameTheCheck() {
        PolicyRuleSet ruleSet = new PolicyRuleSet(PolicyConfigLoader.loadDefault());

        assertThat(ruleSet.getName()).isEqualTo(PolicyRuleSet.NAME);
        assertThat(ruleSet.getRules()).allSatisfy(rule -> assertThat(rule.getSeverity()).isEqualTo(Severity.WARNING));
        assertThat(ruleSet.getRules())
            .extracting(rule -> rule.getDescription())
            .contains("Package filesAnalyzed oneOf [true]", "File copyrightText required (conditional)");
    }
}
