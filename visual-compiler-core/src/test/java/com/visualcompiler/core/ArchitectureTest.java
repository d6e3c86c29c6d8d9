package com.visualcompiler.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests guarding the layering of the compiler core.
 *
 * <p>From the bottom up: {@code model}, then {@code graph}/{@code factory}/{@code language},
 * then {@code semantic}/{@code generator}, then {@code compiler}. {@code io},
 * {@code config} and {@code renderer} sit at the edges.
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.visualcompiler.core");
    }

    /**
     * The node model knows nothing about graphs, languages or code generation.
     */
    @Test
    void model_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.graph..", "..core.factory..", "..core.language..", "..core.semantic..",
                "..core.generator..", "..core.compiler..", "..core.io..", "..core.config..",
                "..core.renderer..");

        rule.check(classes);
    }

    /**
     * The generator lowers graphs and must stay usable without the compile pipeline.
     */
    @Test
    void generator_shouldNotDependOnPipelineOrOutput() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.generator..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.compiler..", "..core.io..", "..core.config..", "..core.renderer..");

        rule.check(classes);
    }

    @Test
    void languageTables_shouldNotDependOnGeneration() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.language..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.graph..", "..core.generator..", "..core.compiler..");

        rule.check(classes);
    }

    /**
     * Renderers only move files around; they never compile.
     */
    @Test
    void renderers_shouldOnlyDependOnRendererTypes() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.renderer..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.model..", "..core.graph..", "..core.generator..", "..core.compiler..",
                "..core.language..", "..core.config..", "..core.io..");

        rule.check(classes);
    }

    @Test
    void rendererApi_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.renderer")
            .should().dependOnClassesThat().resideInAPackage("..core.renderer.impl..");

        rule.check(classes);
    }

    @Test
    void renderers_shouldImplementOutputRenderer() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.renderer.impl..")
            .and().haveSimpleNameEndingWith("Renderer")
            .should().implement("com.visualcompiler.core.renderer.OutputRenderer");

        rule.check(classes);
    }
}
