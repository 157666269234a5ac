package com.flowcheck.core;

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
 *   <li>Rule validators extend the common base class</li>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>The pipeline stages only depend on earlier stages</li>
 *   <li>Rule passes don't depend on the facade</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.flowcheck.core");
    }

    /**
     * Verifies all rule passes extend AbstractRuleValidator, so each one logs and copies
     * its results the same way.
     */
    @Test
    void ruleValidators_shouldExtendAbstractRuleValidator() {
        ArchRule rule = classes()
            .that().resideInAPackage("..validator.impl..")
            .and().haveSimpleNameEndingWith("Validator")
            .should().beAssignableTo("com.flowcheck.core.validator.AbstractRuleValidator");

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
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies the model layer has no dependencies on the pipeline.
     */
    @Test
    void models_shouldNotDependOnPipeline() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..parser..", "..ir..", "..graph..", "..validator..", "..suggestion..", "..analysis..");

        rule.check(classes);
    }

    @Test
    void parser_shouldNotDependOnLaterStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..parser..")
            .should().dependOnClassesThat().resideInAnyPackage("..ir..", "..graph..", "..validator..", "..analysis..");

        rule.check(classes);
    }

    @Test
    void graph_shouldNotDependOnValidators() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..ir..", "..graph..")
            .should().dependOnClassesThat().resideInAPackage("..validator..");

        rule.check(classes);
    }

    /**
     * Verifies rule passes never reach back into the facade that runs them.
     */
    @Test
    void validators_shouldNotDependOnFacade() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..validator..")
            .should().dependOnClassesThat().haveFullyQualifiedName("com.flowcheck.core.WorkflowValidator");

        rule.check(classes);
    }

    @Test
    void analysis_shouldNotDependOnRulePasses() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..analysis..")
            .should().dependOnClassesThat().resideInAPackage("..validator..");

        rule.check(classes);
    }
}
