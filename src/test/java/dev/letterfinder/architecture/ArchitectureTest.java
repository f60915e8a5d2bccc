package dev.letterfinder.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.letterfinder", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // Stages only look downstream: pipeline > analysis > ocr > download > search > archive > config
    @ArchTest
    static final ArchRule config_should_not_depend_on_stages =
        noClasses().that().resideInAPackage("..config..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..archive..", "..search..", "..download..", "..ocr..", "..analysis..", "..pipeline.."
            );

    @ArchTest
    static final ArchRule archive_should_not_depend_on_later_stages =
        noClasses().that().resideInAPackage("..archive..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..search..", "..download..", "..ocr..", "..analysis..", "..pipeline.."
            );

    @ArchTest
    static final ArchRule ocr_should_not_know_about_scoring =
        noClasses().that().resideInAPackage("..ocr..")
            .should().dependOnClassesThat().resideInAnyPackage("..analysis..", "..pipeline..");

    // Only the pipeline orchestrates; nothing depends on it
    @ArchTest
    static final ArchRule nothing_depends_on_pipeline =
        noClasses().that().resideOutsideOfPackage("..pipeline..")
            .and().resideInAPackage("dev.letterfinder..")
            .should().dependOnClassesThat().resideInAPackage("..pipeline..");

    // Tess4J stays behind the TextExtractor seam
    @ArchTest
    static final ArchRule tesseract_only_in_ocr =
        noClasses().that().resideOutsideOfPackage("..ocr..")
            .should().dependOnClassesThat().resideInAPackage("net.sourceforge.tess4j..");

    // No cyclic dependencies between top-level packages
    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.letterfinder.(*)..").should().beFreeOfCycles();
}
