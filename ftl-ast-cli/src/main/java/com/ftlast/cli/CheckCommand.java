package com.ftlast.cli;

import com.ftlast.core.config.ParserConfig;
import com.ftlast.core.parser.ParseException;
import com.ftlast.core.template.TemplateSet;
import com.ftlast.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check template files for syntax errors.
 *
 * <p>Every file with the configured extension below the given directories is parsed
 * into one {@link TemplateSet}, named by its path relative to its directory. Plain
 * files given as arguments are checked whatever their extension. A file that defines
 * the same non-empty template twice fails; across files, the later definition wins.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ftlast check src/main/resources/templates
 * ftlast check --fail-fast page.ftl layout.ftl
 * }</pre>
 */
@Command(
    name = "check",
    description = "Check template files for syntax errors",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private ConfigOption configOption;

    @Parameters(arity = "1..*", description = "Template files or directories")
    private List<Path> paths;

    @Option(names = {"--fail-fast"}, description = "Stop at the first broken template (default: from config)")
    private Boolean failFast;

    @Option(names = {"-e", "--extension"}, description = "Template file extension (default: from config)")
    private String extension;

    /** File to check with the template name it is registered under. */
    private record TemplateFile(Path path, String name) {}

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        ParserConfig config = configOption.load();
        boolean stopEarly = failFast != null ? failFast : config.templates().failFast();
        String ext = extension != null ? extension : config.templates().extension();

        List<TemplateFile> files;
        try {
            files = collect(ext);
        } catch (IOException e) {
            log.error("Failed to list template files", e);
            out.println("✗ Cannot list templates: " + e.getMessage());
            out.flush();
            return 1;
        }

        TemplateSet templates = new TemplateSet("check");
        int failures = 0;
        for (TemplateFile file : files) {
            try {
                templates.parse(file.name(), FileUtils.readString(file.path()));
                out.println("✓ " + file.name());
            } catch (ParseException e) {
                failures++;
                log.debug("Template {} failed to parse", file.path(), e);
                out.println("✗ " + file.path() + ": " + e.getMessage());
            } catch (IOException e) {
                failures++;
                log.error("Failed to read template file: {}", file.path(), e);
                out.println("✗ " + file.path() + ": cannot read: " + e.getMessage());
            }
            if (failures > 0 && stopEarly) {
                break;
            }
        }

        out.println();
        out.printf("Checked %d files, %d templates defined, %d failed%n", files.size(), templates.size(), failures);
        out.flush();
        log.info("Check finished: {} files, {} failed", files.size(), failures);
        return failures == 0 ? 0 : 1;
    }

    private List<TemplateFile> collect(String ext) throws IOException {
        List<TemplateFile> files = new ArrayList<>();
        for (Path path : paths) {
            if (Files.isDirectory(path)) {
                for (Path file : FileUtils.findByExtension(path, ext)) {
                    files.add(new TemplateFile(file, FileUtils.templateName(path, file)));
                }
            } else if (Files.isRegularFile(path)) {
                Path parent = path.toAbsolutePath().getParent();
                files.add(new TemplateFile(path, FileUtils.templateName(parent, path.toAbsolutePath())));
            } else {
                throw new IOException("no such file or directory: " + path);
            }
        }
        log.debug("Collected {} template files", files.size());
        return files;
    }
}
