package com.sbomcheck.core.config;

import com.sbomcheck.core.model.EntityType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PolicyConfigLoader}.
 */
class PolicyConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("policy.yaml");
        Files.writeString(configFile, """
            Package:
              - fieldPath: supplier
                check: nonPlaceholder
              - fieldPath: checksums.algorithm
                check: oneOf
                allowedValues: [SHA1, SHA256]
            File:
              - fieldPath: copyrightText
                check: required
                message: Files need a copyright.
                when:
                  - fieldPath: licenseConcluded
                    check: nonPlaceholder
            Document:
              - fieldPath: packages
                check: minItems
                minItems: 2
              - check: describesFirstPackage
            """);

        PolicyConfig config = PolicyConfigLoader.load(configFile);

        assertThat(config.checks().keySet())
            .containsExactly(EntityType.PACKAGE, EntityType.FILE, EntityType.DOCUMENT);
        assertThat(config.checksFor(EntityType.PACKAGE))
            .extracting(PolicyCheck::fieldPath)
            .containsExactly("supplier", "checksums.algorithm");
        assertThat(config.checksFor(EntityType.PACKAGE).get(1).allowedValues()).containsExactly("SHA1", "SHA256");

        PolicyCheck fileCheck = config.checksFor(EntityType.FILE).get(0);
        assertThat(fileCheck.check()).isEqualTo(CheckType.REQUIRED);
        assertThat(fileCheck.message()).isEqualTo("Files need a copyright.");
        assertThat(fileCheck.when()).singleElement().satisfies(condition -> {
            assertThat(condition.fieldPath()).isEqualTo("licenseConcluded");
            assertThat(condition.check()).isEqualTo(CheckType.NON_PLACEHOLDER);
        });

        assertThat(config.checksFor(EntityType.DOCUMENT).get(0).minItems()).isEqualTo(2);
        assertThat(config.checksFor(EntityType.DOCUMENT).get(1).fieldPath()).isEqualTo(PolicyCheck.DESCRIBES_FIELD);
        assertThat(config.checksFor(EntityType.SNIPPET)).isEmpty();
    }

    @Test
    void load_json_isAccepted() throws IOException {
        Path configFile = tempDir.resolve("policy.json");
        Files.writeString(configFile, """
            {"Relationship": [{"fieldPath": "comment", "check": "required"}]}
            """);

        PolicyConfig config = PolicyConfigLoader.load(configFile);

        assertThat(config.checksFor(EntityType.RELATIONSHIP)).hasSize(1);
    }

    @Test
    void load_emptyFile_returnsEmptyConfig() throws IOException {
        Path configFile = tempDir.resolve("empty.yaml");
        Files.writeString(configFile, "");

        PolicyConfig config = PolicyConfigLoader.load(configFile);

        assertThat(config.isEmpty()).isTrue();
    }

    @Test
    void load_missingFile_throws() {
        Path configFile = tempDir.resolve("nonexistent.yaml");

        assertThatThrownBy(() -> PolicyConfigLoader.load(configFile))
            .isInstanceOf(PolicyConfigurationException.class)
            .hasMessageContaining("Policy file not found");
    }

    @Test
    void load_directory_throws() {
        assertThatThrownBy(() -> PolicyConfigLoader.load(tempDir))
            .isInstanceOf(PolicyConfigurationException.class)
            .hasMessageContaining("not readable");
    }

    @Test
    void parse_unknownEntityType_throws() {
        assertThatThrownBy(() -> PolicyConfigLoader.parse("""
            Component:
              - fieldPath: name
                check: required
            """))
            .isInstanceOf(PolicyConfigurationException.class)
            .hasMessageContaining("unknown entity type 'Component'");
    }

    @Test
    void parse_unknownCheck_throws() {
        assertThatThrownBy(() -> PolicyConfigLoader.parse("""
            Package:
              - fieldPath: name
                check: mandatory
            """))
            .isInstanceOf(PolicyConfigurationException.class)
            .hasMessageContaining("unknown check 'mandatory'");
    }

    @Test
    void parse_oneOfWithoutValues_throws() {
        assertThatThrownBy(() -> PolicyConfigLoader.parse("""
            Package:
              - fieldPath: primaryPackagePurpose
                check: oneOf
            """))
            .isInstanceOf(PolicyConfigurationException.class)
            .hasMessageContaining("needs allowedValues");
    }

    @Test
    void parse_missingFieldPath_throws() {
        assertThatThrownBy(() -> PolicyConfigLoader.parse("""
            File:
              - check: required
            """))
            .isInstanceOf(PolicyConfigurationException.class)
            .hasMessageContaining("fieldPath is required");
    }

    @Test
    void parse_zeroMinItems_throws() {
        assertThatThrownBy(() -> PolicyConfigLoader.parse("""
            Document:
              - fieldPath: files
                check: minItems
                minItems: 0
            """))
            .isInstanceOf(PolicyConfigurationException.class)
            .hasMessageContaining("minItems of at least 1");
    }

    @Test
    void parse_describesFirstPackageOutsideDocument_throws() {
        assertThatThrownBy(() -> PolicyConfigLoader.parse("""
            Package:
              - check: describesFirstPackage
            """))
            .isInstanceOf(PolicyConfigurationException.class)
            .hasMessageContaining("Document only");
    }

    @Test
    void parse_notAMapping_throws() {
        assertThatThrownBy(() -> PolicyConfigLoader.parse("- fieldPath: name"))
            .isInstanceOf(PolicyConfigurationException.class)
            .hasMessageContaining("expected a mapping");
    }

    @Test
    void parse_malformedYaml_throws() {
        assertThatThrownBy(() -> PolicyConfigLoader.parse("Package: [unclosed"))
            .isInstanceOf(PolicyConfigurationException.class)
            .hasMessageContaining("Invalid policy");
    }

    @Test
    void loadDefault_containsCompletenessChecks() {
        PolicyConfig config = PolicyConfigLoader.loadDefault();

        assertThat(config.checksFor(EntityType.DOCUMENT))
            .extracting(PolicyCheck::check)
            .contains(CheckType.MIN_ITEMS, CheckType.DESCRIBES_FIRST_PACKAGE);
        assertThat(config.checksFor(EntityType.PACKAGE))
            .extracting(PolicyCheck::fieldPath)
            .containsExactly("supplier", "filesAnalyzed", "copyrightText");
        assertThat(config.checksFor(EntityType.FILE))
            .extracting(PolicyCheck::fieldPath)
            .containsExactly("fileName", "licenseInfoInFiles", "copyrightText");
    }
}
