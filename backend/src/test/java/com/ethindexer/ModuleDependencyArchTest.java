package com.ethindexer;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: domain and common stay free of ingestion and Spring wiring.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.ethindexer");
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion..", "..config..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..ingestion..", "..config..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.ethindexer.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }

    @Test
    void ingestion_pipeline_must_not_depend_on_job_triggers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.pipeline..")
                .should().dependOnClassesThat().resideInAPackage("..ingestion.job..");
        rule.check(classes);
    }

    @Test
    void ingestion_sync_must_not_depend_on_job_triggers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.sync..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion.job..", "com.ethindexer.config..");
        rule.check(classes);
    }

    @Test
    void decoder_must_not_call_rpc_or_store() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.decoder..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion.adapter..", "..ingestion.sync..")
                .orShould().dependOnClassesThat().haveSimpleNameEndingWith("Store");
        rule.check(classes);
    }
}
