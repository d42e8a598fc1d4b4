package com.ftlast.cli;

import com.ftlast.core.ast.Node;
import com.ftlast.core.ast.TextFormat;
import com.ftlast.core.config.ParserConfig;
import com.ftlast.core.parser.ErrorContext;
import com.ftlast.core.parser.FtlParser;
import com.ftlast.core.parser.ParseException;
import com.ftlast.core.parser.Tree;
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
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to parse a template file and print the trees it defines.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Print all trees, text quoted
 * ftlast parse page.ftl
 *
 * # Print raw text and the location of every top-level node
 * ftlast parse --format raw --positions page.ftl
 * }</pre>
 */
@Command(
    name = "parse",
    description = "Parse a template file and print its trees",
    mixinStandardHelpOptions = true
)
public class ParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private ConfigOption configOption;

    @Parameters(index = "0", description = "Template file")
    private Path file;

    @Option(names = {"-n", "--name"}, description = "Template name (default: file name without extension)")
    private String name;

    @Option(names = {"-f", "--format"}, description = "Text format: ${COMPLETION-CANDIDATES} (default: from config)")
    private TextFormat format;

    @Option(names = {"-p", "--positions"}, description = "Print the location of every top-level node")
    private boolean positions;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        ParserConfig config = configOption.load();
        TextFormat textFormat = format != null ? format : config.diagnostics().textFormat();
        String templateName = name != null ? name : FileUtils.templateName(file.toAbsolutePath().getParent(), file.toAbsolutePath());

        try {
            log.info("Parsing {} as {}", file, templateName);
            Map<String, Tree> trees = FtlParser.parse(templateName, FileUtils.readString(file));

            for (Tree tree : trees.values()) {
                out.println("== " + tree.name() + " ==");
                out.println(tree.root().render(textFormat));
                if (positions) {
                    printPositions(out, tree, config.diagnostics().contextLength());
                }
            }
            out.flush();
            return 0;

        } catch (ParseException e) {
            log.debug("Parse failed", e);
            err.println("✗ " + e.getMessage());
            err.flush();
            return 1;
        } catch (IOException e) {
            log.error("Failed to read template file: {}", file, e);
            err.println("✗ Cannot read " + file + ": " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private void printPositions(PrintWriter out, Tree tree, int contextLength) {
        for (Node node : tree.root().nodes()) {
            ErrorContext where = tree.errorContext(node, contextLength);
            out.printf("  %-10s %s  %s%n", node.type(), where.location(), where.context());
        }
    }
}
