package com.ftlast;

import ch.qos.logback.classic.Level;
import com.ftlast.cli.CheckCommand;
import com.ftlast.cli.ParseCommand;
import com.ftlast.cli.TokensCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for the template compiler tools.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code parse} - Parse a template file and print its trees</li>
 *   <li>{@code tokens} - Print the token stream of a template file</li>
 *   <li>{@code check} - Check template files for syntax errors</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Check every template below src/templates
 * ftlast check src/templates
 *
 * # Show how a template is tokenized
 * ftlast tokens page.ftl
 *
 * # Print the parsed tree with raw text
 * ftlast -v parse --format raw page.ftl
 * }</pre>
 */
@Command(
    name = "ftlast",
    mixinStandardHelpOptions = true,
    version = "ftlast 1.0.0-SNAPSHOT",
    description = "FreeMarker-style template parser and syntax checker",
    subcommands = {
        ParseCommand.class,
        TokensCommand.class,
        CheckCommand.class
    }
)
public class FtlAstCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(FtlAstCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("ftlast - FreeMarker-style template parser");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'ftlast --help' to see available commands");
        System.out.println("Use 'ftlast <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with the settings shared by {@link #main(String[])} and tests.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        FtlAstCLI cli = new FtlAstCLI();
        return new CommandLine(cli)
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setExecutionStrategy(parseResult -> {
                cli.configureLogging();
                return new CommandLine.RunLast().execute(parseResult);
            });
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
