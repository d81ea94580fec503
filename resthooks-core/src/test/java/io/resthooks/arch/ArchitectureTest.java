package io.resthooks.arch;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

class ArchitectureTest {

    @Test
    void coreShouldNotDependOnSpring() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.resthooks..")
                .should().dependOnClassesThat().resideInAPackage("org.springframework..");
        rule.check(importedMainClasses());
    }

    @Test
    void graphAndRequestShouldNotDependOnHooks() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("io.resthooks.graph..", "io.resthooks.request..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("io.resthooks.hooks..", "io.resthooks.store..", "io.resthooks.service..");
        rule.check(importedMainClasses());
    }

    @Test
    void storeShouldNotDependOnHookExecution() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.resthooks.store..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("io.resthooks.hooks..", "io.resthooks.service..");
        rule.check(importedMainClasses());
    }

    @Test
    void traversalShouldNotDependOnExecution() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.resthooks.hooks.traversal..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("io.resthooks.hooks.execution..", "io.resthooks.store..", "io.resthooks.service..");
        rule.check(importedMainClasses());
    }

    @Test
    void mainCodeShouldNotDependOnTestPackages() {
        ArchRule rule = noClasses()
                .should().dependOnClassesThat().resideInAPackage("..test..");
        rule.check(importedMainClasses());
    }

    private static JavaClasses importedMainClasses() {
        return new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("io.resthooks..");
    }
}
