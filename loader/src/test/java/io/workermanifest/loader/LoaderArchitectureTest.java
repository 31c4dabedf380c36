package io.workermanifest.loader;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/** Architecture guardrails for the loader module. */
@AnalyzeClasses(
        packages = "io.workermanifest.loader",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class LoaderArchitectureTest {

    @ArchTest
    static final ArchRule onlyOverlayReadsEnvironment = noClasses()
            .that()
            .doNotHaveSimpleName("PrefixedEnvironmentOverlay")
            .should()
            .callMethod(System.class, "getenv", String.class)
            .because("process environment access is confined to PrefixedEnvironmentOverlay");

    @ArchTest
    static final ArchRule noCoreInternalResolution = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.workermanifest.core.resolve..")
            .because("the loader reads documents; resolution belongs to the engine");
}
