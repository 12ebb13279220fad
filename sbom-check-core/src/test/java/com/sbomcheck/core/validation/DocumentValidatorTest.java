package com.sbomcheck.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.sbomcheck.core.SpdxFixtures;
import com.sbomcheck.core.loader.DocumentSource;
import com.sbomcheck.core.report.DocumentStatus;
import com.sbomcheck.core.report.ValidationReport;
import com.sbomcheck.core.rule.RuleEngine;
import com.sbomcheck.core.rule.SpecificationRuleSet;
import com.sbomcheck.core.rule.spdx.StructureRule;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DocumentValidator}.
 */
class DocumentValidatorTest {

    private final DocumentValidator validator = new DocumentValidator(SpecificationRuleSet.load().getRules());

    @Test
    void validate_parsedDocument_runsEveryStage() {
        ValidationReport report = validator.validate("valid.spdx.json", SpdxFixtures.valid());

        assertThat(report.documentId()).isEqualTo("valid.spdx.json");
        assertThat(report.status()).isEqualTo(DocumentStatus.PASS);
    }

    @Test
    void validate_nonObjectRoot_reportsStructureViolation() {
        ValidationReport report = validator.validate("array.spdx.json", SpdxFixtures.MAPPER.createArrayNode());

        assertThat(report.status()).isEqualTo(DocumentStatus.FAIL);
        assertThat(report.violations()).extracting(violation -> violation.ruleCode())
            .containsOnly(StructureRule.CODE);
    }

    @Test
    void validate_unexpectedFailure_becomesEngineErrorReport() {
        DocumentSource exploding = new DocumentSource() {
            @Override
            public String documentId() {
                return "exploding.spdx.json";
            }

            @Override
            public JsonNode load() {
                throw new IllegalStateException("disk on fire");
            }
        };

        ValidationReport report = validator.validate(exploding);

        assertThat(report.status()).isEqualTo(DocumentStatus.FAIL);
        assertThat(report.violations()).singleElement().satisfies(violation -> {
            assertThat(violation.ruleCode()).isEqualTo(RuleEngine.ENGINE_ERROR);
            assertThat(violation.message()).contains("disk on fire");
        });
    }

    @Test
    void validate_stackOverflow_becomesEngineErrorReport() {
        DocumentSource recursive = new DocumentSource() {
            @Override
            public String documentId() {
                return "recursive.spdx.json";
            }

            @Override
            public JsonNode load() {
                throw new StackOverflowError();
            }
        };

        ValidationReport report = validator.validate(recursive);

        assertThat(report.status()).isEqualTo(DocumentStatus.FAIL);
        assertThat(report.violations()).singleElement().satisfies(violation -> {
            assertThat(violation.ruleCode()).isEqualTo(RuleEngine.ENGINE_ERROR);
            assertThat(violation.message()).contains("StackOverflowError");
        });
    }
}
