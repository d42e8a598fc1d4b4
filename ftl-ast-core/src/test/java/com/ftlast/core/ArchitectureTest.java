package com.ftlast.core;

import com.ftlast.core.ast.Node;
import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate the layering of the template parser.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Utilities depend on nothing else in the project</li>
 *   <li>The lexer knows nothing about trees</li>
 *   <li>Nodes don't depend on the parser that builds them</li>
 *   <li>Configuration models are immutable records</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.ftlast.core");
    }

    @Test
    void utilClasses_shouldNotDependOnProjectPackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..lexer..", "..ast..", "..parser..", "..template..", "..config..");

        rule.check(classes);
    }

    /**
     * The lexer produces tokens only; trees are built on top of it.
     */
    @Test
    void lexer_shouldNotDependOnTrees() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..lexer..")
            .should().dependOnClassesThat().resideInAnyPackage("..ast..", "..parser..", "..template..", "..config..");

        rule.check(classes);
    }

    @Test
    void nodes_shouldNotDependOnParser() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..ast..")
            .should().dependOnClassesThat().resideInAnyPackage("..parser..", "..template..", "..config..");

        rule.check(classes);
    }

    @Test
    void parser_shouldNotDependOnTemplateSetOrConfig() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..parser..")
            .should().dependOnClassesThat().resideInAnyPackage("..template..", "..config..");

        rule.check(classes);
    }

    @Test
    void nodes_shouldImplementNode() {
        ArchRule rule = classes()
            .that().resideInAPackage("..ast..")
            .and().haveSimpleNameEndingWith("Node")
            .should().beAssignableTo(Node.class);

        rule.check(classes);
    }

    /**
     * Configuration is deserialized once and never modified.
     */
    @Test
    void configModels_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..config..")
            .and().haveSimpleNameEndingWith("Config")
            .should().beRecords();

        rule.check(classes);
    }
}
