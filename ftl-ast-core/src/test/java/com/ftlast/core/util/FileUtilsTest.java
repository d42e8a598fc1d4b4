package com.ftlast.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void findFiles_withMatchingPattern_returnsFiles() throws IOException {
        Path file1 = tempDir.resolve("layouts/main.ftl");
        Path file2 = tempDir.resolve("layouts/partials/footer.ftl");
        Files.createDirectories(file2.getParent());
        Files.writeString(file1, "main");
        Files.writeString(file2, "footer");

        List<Path> files = FileUtils.findFiles(tempDir, "**/*.ftl");

        assertThat(files).containsExactly(file1, file2);
    }

    @Test
    void findFiles_withNoMatches_returnsEmptyList() throws IOException {
        List<Path> files = FileUtils.findFiles(tempDir, "**/*.ftl");

        assertThat(files).isEmpty();
    }

    @Test
    void findByExtension_atAnyDepth_returnsSortedMatches() throws IOException {
        Path nested = tempDir.resolve("b/page.ftl");
        Path top = tempDir.resolve("a.ftl");
        Files.createDirectories(nested.getParent());
        Files.writeString(nested, "x");
        Files.writeString(top, "y");
        Files.writeString(tempDir.resolve("readme.txt"), "z");

        List<Path> files = FileUtils.findByExtension(tempDir, "ftl");

        assertThat(files).containsExactly(top, nested);
    }

    @Test
    void readString_withExistingFile_returnsContent() throws IOException {
        Path file = tempDir.resolve("page.ftl");
        Files.writeString(file, "Hello ${name}!");

        assertThat(FileUtils.readString(file)).isEqualTo("Hello ${name}!");
    }

    @Test
    void readString_withMissingFile_throwsIOException() {
        assertThatThrownBy(() -> FileUtils.readString(tempDir.resolve("missing.ftl")))
            .isInstanceOf(IOException.class);
    }

    @Test
    void getExtension_variousNames_returnsExtension() {
        assertThat(FileUtils.getExtension(Path.of("main.ftl"))).isEqualTo("ftl");
        assertThat(FileUtils.getExtension(Path.of("archive.tar.gz"))).isEqualTo("gz");
        assertThat(FileUtils.getExtension(Path.of("README"))).isEmpty();
        assertThat(FileUtils.getExtension(Path.of(".hidden"))).isEmpty();
    }

    @Test
    void templateName_nestedFile_usesSlashesWithoutExtension() {
        Path file = tempDir.resolve("layouts").resolve("main.ftl");

        assertThat(FileUtils.templateName(tempDir, file)).isEqualTo("layouts/main");
        assertThat(FileUtils.templateName(tempDir, tempDir.resolve("index.ftl"))).isEqualTo("index");
    }
}
