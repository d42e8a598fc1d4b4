package com.ftlast.core.util;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for locating and reading template files.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files matching a glob pattern starting from a root directory.
     *
     * <p>The pattern is matched against paths relative to {@code rootPath},
     * e.g. {@code **}{@code /*.ftl} or {@code layouts/*.ftl}.
     *
     * @param rootPath root directory to search from
     * @param globPattern glob pattern
     * @return matching paths, sorted
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);

        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> matcher.matches(rootPath.relativize(path)))
                .sorted()
                .toList();
        }
    }

    /**
     * Finds all files with an extension below a directory, at any depth.
     *
     * @param rootPath root directory to search from
     * @param extension extension without the dot
     * @return matching paths, sorted
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findByExtension(Path rootPath, String extension) throws IOException {
        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> getExtension(path).equals(extension))
                .sorted()
                .toList();
        }
    }

    /**
     * Reads a file as a UTF-8 string.
     *
     * @param path path to file
     * @return file content as string
     * @throws IOException if reading fails
     */
    public static String readString(Path path) throws IOException {
        return Files.readString(path);
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    /**
     * Derives a template name from a file: its path relative to the root, with
     * {@code /} separators and without extension.
     *
     * @param rootPath template root directory
     * @param file template file below {@code rootPath}
     * @return template name, e.g. {@code layouts/main} for {@code layouts/main.ftl}
     */
    public static String templateName(Path rootPath, Path file) {
        Path relative = rootPath.relativize(file);
        StringBuilder sb = new StringBuilder();
        for (Path part : relative) {
            if (sb.length() > 0) {
                sb.append('/');
            }
            sb.append(part);
        }
        String name = sb.toString();
        String extension = getExtension(file);
        return extension.isEmpty() ? name : name.substring(0, name.length() - extension.length() - 1);
    }
}
