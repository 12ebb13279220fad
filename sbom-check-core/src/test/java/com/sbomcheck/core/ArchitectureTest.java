package com.sbomcheck.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Specification rules extend the common rule base class</li>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>The model, parser and rule layers know nothing about orchestration or output</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.sbomcheck.core");
    }

    /**
     * Verifies every concrete rule extends AbstractRule, so dispatch and violation creation
     * behave the same everywhere.
     */
    @Test
    void rules_shouldExtendAbstractRule() {
        ArchRule rule = classes()
            .that().resideInAnyPackage("..rule.spdx..", "..rule.policy..")
            .and().haveSimpleNameEndingWith("Rule")
            .should().beAssignableTo("com.sbomcheck.core.rule.AbstractRule");

        rule.check(classes);
    }

    /**
     * Verifies rule providers live next to the rules they contribute.
     */
    @Test
    void ruleProviders_shouldResideInSpdxPackage() {
        ArchRule rule = classes()
            .that().implement("com.sbomcheck.core.rule.RuleProvider")
            .should().resideInAPackage("..rule.spdx..");

        rule.check(classes);
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies the model layer has no dependencies on rules, validation or rendering.
     */
    @Test
    void models_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage("..rule..", "..validation..", "..renderer..");

        rule.check(classes);
    }

    /**
     * Verifies rules are evaluated without knowledge of how runs are orchestrated or rendered.
     */
    @Test
    void rules_shouldNotDependOnValidationOrRendering() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..rule..", "..resolver..", "..parser..", "..license..")
            .should().dependOnClassesThat().resideInAnyPackage("..validation..", "..renderer..");

        rule.check(classes);
    }

    /**
     * Verifies renderers consume reports only.
     */
    @Test
    void renderers_shouldNotDependOnRules() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..renderer..")
            .should().dependOnClassesThat().resideInAnyPackage("..rule..", "..validation..", "..loader..");

        rule.check(classes);
    }
}
