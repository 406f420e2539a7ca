package dev.mass.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.mass", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // Pipeline stages must not reach into the surfaces that expose them.
    @ArchTest
    static final ArchRule features_should_not_depend_on_adapters =
        noClasses().that().resideInAnyPackage(
                "..scrape..", "..enrich..", "..registry..", "..pipeline..", "..batch.."
            )
            .should().dependOnClassesThat().resideInAnyPackage(
                "..mcp..", "..api.."
            );

    // The MCP surface and the REST surface share the pipeline, never each other
    @ArchTest
    static final ArchRule adapters_should_not_depend_on_each_other =
        noClasses().that().resideInAPackage("..mcp..")
            .should().dependOnClassesThat().resideInAPackage("..api..");

    @ArchTest
    static final ArchRule config_should_not_depend_on_adapters =
        noClasses().that().resideInAPackage("..config..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..mcp..", "..api..", "..batch.."
            );

    // No cyclic dependencies between top-level packages
    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.mass.(*)..").should().beFreeOfCycles();
}
