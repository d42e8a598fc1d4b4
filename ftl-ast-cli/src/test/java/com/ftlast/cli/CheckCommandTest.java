package com.ftlast.cli;

import com.ftlast.FtlAstCLI;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CheckCommand}.
 */
class CheckCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = FtlAstCLI.commandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(new StringWriter()));
        return cmd.execute(args);
    }

    private Path write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    void check_validDirectory_reportsEveryTemplate() throws IOException {
        write("page.ftl", "Hi ${name}");
        write("layouts/base.ftl", "<#macro header>H</#macro>");
        write("notes.txt", "<#if");

        int exitCode = run("check", tempDir.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("✓ page")
            .contains("✓ layouts/base")
            .doesNotContain("notes")
            .contains("Checked 2 files, 3 templates defined, 0 failed");
    }

    @Test
    void check_brokenTemplate_reportsErrorAndFails() throws IOException {
        write("good.ftl", "fine");
        Path bad = write("bad.ftl", "<#if a>x");

        int exitCode = run("check", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString())
            .contains("✗ " + bad + ": template: bad:")
            .contains("unexpected EOF")
            .contains("✓ good")
            .contains("Checked 2 files, 1 templates defined, 1 failed");
    }

    @Test
    void check_failFast_stopsAtFirstFailure() throws IOException {
        write("a.ftl", "${");
        write("b.ftl", "<#if>");

        int exitCode = run("check", "--fail-fast", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString())
            .contains("unclosed interpolation")
            .doesNotContain("b.ftl")
            .contains("Checked 2 files, 0 templates defined, 1 failed");
    }

    @Test
    void check_customExtension_selectsMatchingFiles() throws IOException {
        write("page.tpl", "${x}");
        write("other.ftl", "${y}");

        int exitCode = run("check", "-e", "tpl", tempDir.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("✓ page")
            .doesNotContain("other")
            .contains("Checked 1 files");
    }

    @Test
    void check_plainFileArgument_isCheckedWhateverItsExtension() throws IOException {
        Path file = write("standalone.html", "<#list xs as x>${x}</#list>");

        int exitCode = run("check", file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("✓ standalone");
    }

    @Test
    void check_missingPath_fails() {
        int exitCode = run("check", tempDir.resolve("missing").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("Cannot list templates");
    }

    @Test
    void check_configFile_setsExtensionAndFailFast() throws IOException {
        write("a.tpl", "${");
        write("b.tpl", "${");
        Path config = write("conf/ftl-ast.yaml", """
            templates:
              extension: tpl
              failFast: true
            """);

        int exitCode = run("check", "-c", config.toString(), tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("Checked 2 files, 0 templates defined, 1 failed");
    }
}
