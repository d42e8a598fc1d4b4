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
 * Tests for {@link TokensCommand}.
 */
class TokensCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = FtlAstCLI.commandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private Path template(String content) throws IOException {
        Path file = tempDir.resolve("page.ftl");
        Files.writeString(file, content);
        return file;
    }

    @Test
    void tokens_validTemplate_printsOneLinePerToken() throws IOException {
        Path file = template("a${b}");

        int exitCode = run("tokens", file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines())
            .hasSize(5)
            .first().asString().contains("TEXT").contains("\"a\"");
        assertThat(out.toString())
            .contains("LEFT_INTERPOLATION")
            .contains("IDENTIFIER")
            .contains("RIGHT_INTERPOLATION")
            .contains("EOF");
    }

    @Test
    void tokens_skipSpaces_omitsSpaceTokens() throws IOException {
        Path file = template("${a + b}");

        run("tokens", "--skip-spaces", file.toString());

        assertThat(out.toString())
            .contains("ADD")
            .doesNotContain("SPACE");
    }

    @Test
    void tokens_scanError_endsWithErrorAndFails() throws IOException {
        Path file = template("${a");

        int exitCode = run("tokens", file.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString())
            .contains("ERROR")
            .contains("unclosed interpolation")
            .doesNotContain("EOF");
    }

    @Test
    void tokens_missingFile_fails() {
        int exitCode = run("tokens", tempDir.resolve("missing.ftl").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Cannot read");
    }
}
