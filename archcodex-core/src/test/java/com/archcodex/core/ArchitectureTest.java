package com.archcodex.core;

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
 *   <li>Validators and adapters extend their base classes</li>
 *   <li>Base classes don't depend on implementations</li>
 *   <li>Domain models are immutable records and stay free of engine code</li>
 *   <li>Utilities stay low-level</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.archcodex.core");
    }

    /**
     * Every rule implementation goes through AbstractConstraintValidator so logging and
     * violation building stay uniform.
     */
    @Test
    void validators_shouldExtendAbstractConstraintValidator() {
        ArchRule rule = classes()
            .that().resideInAPackage("..validator.impl..")
            .and().haveSimpleNameEndingWith("Validator")
            .should().beAssignableTo("com.archcodex.core.validator.base.AbstractConstraintValidator");

        rule.check(classes);
    }

    @Test
    void adapters_shouldExtendAbstractSemanticModelAdapter() {
        ArchRule rule = classes()
            .that().resideInAPackage("..adapter.impl..")
            .and().haveSimpleNameEndingWith("Adapter")
            .should().beAssignableTo("com.archcodex.core.adapter.base.AbstractSemanticModelAdapter");

        rule.check(classes);
    }

    @Test
    void baseClasses_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..validator.base..", "..adapter.base..")
            .should().dependOnClassesThat().resideInAnyPackage("..validator.impl..", "..adapter.impl..");

        rule.check(classes);
    }

    /**
     * Models are plain immutable data; the intent registry is the one lookup class allowed.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().doNotHaveSimpleName("IntentRegistry")
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnEngine() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..validator..", "..validation..", "..resolver..", "..adapter..", "..project..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnDomain() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..model..", "..validator..", "..validation..", "..adapter..", "..resolver..");

        rule.check(classes);
    }

    @Test
    void validators_shouldNotDependOnOrchestration() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..validator.impl..")
            .should().dependOnClassesThat().resideInAnyPackage("..validation..", "..resolver..");

        rule.check(classes);
    }
}
