package com.endpointdoc.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests to validate the layering of the documentation pipeline.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Descriptor models are immutable records</li>
 *   <li>Lower layers never reach up into operation processing or rendering</li>
 *   <li>SPI implementations live in their designated packages</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_JARS)
            .importPackages("com.endpointdoc.core");
    }

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
     * Models are plain descriptor data and must stay usable without the pipeline.
     */
    @Test
    void models_shouldNotDependOnPipeline() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..schema..", "..operation..", "..processor..", "..document..", "..renderer..");

        rule.check(classes);
    }

    @Test
    void schemaClasses_shouldNotDependOnOperationsOrProcessors() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..schema..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..operation..", "..processor..", "..document..", "..renderer..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnPipeline() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..schema..", "..operation..", "..processor..", "..document..", "..renderer..");

        rule.check(classes);
    }

    @Test
    void operationClasses_shouldNotDependOnProcessorsOrRendering() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..operation..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..processor..", "..document..", "..renderer..");

        rule.check(classes);
    }

    @Test
    void operationProcessors_shouldResideInProcessorPackage() {
        ArchRule rule = classes()
            .that().implement("com.endpointdoc.core.processor.OperationProcessor")
            .should().resideInAPackage("..processor..");

        rule.check(classes);
    }

    @Test
    void documentRenderers_shouldResideInRendererImplPackage() {
        ArchRule rule = classes()
            .that().implement("com.endpointdoc.core.renderer.DocumentRenderer")
            .should().resideInAPackage("..renderer.impl..");

        rule.check(classes);
    }

    @Test
    void renderers_shouldNotDependOnProcessing() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..renderer..")
            .should().dependOnClassesThat().resideInAnyPackage("..processor..", "..operation..");

        rule.check(classes);
    }
}
