package com.ftlast.cli;

import com.ftlast.core.lexer.Lexer;
import com.ftlast.core.lexer.Token;
import com.ftlast.core.lexer.TokenType;
import com.ftlast.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to print the token stream of a template file, one token per line.
 *
 * <p>Exits with 1 when scanning stops at an error token.
 */
@Command(
    name = "tokens",
    description = "Print the token stream of a template file",
    mixinStandardHelpOptions = true
)
public class TokensCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TokensCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Template file")
    private Path file;

    @Option(names = {"-s", "--skip-spaces"}, description = "Omit SPACE tokens")
    private boolean skipSpaces;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        String text;
        try {
            text = FileUtils.readString(file);
        } catch (IOException e) {
            log.error("Failed to read template file: {}", file, e);
            PrintWriter err = spec.commandLine().getErr();
            err.println("✗ Cannot read " + file + ": " + e.getMessage());
            err.flush();
            return 1;
        }

        List<Token> tokens = Lexer.tokenize(file.getFileName().toString(), text);
        log.debug("Scanned {} tokens from {}", tokens.size(), file);
        for (Token token : tokens) {
            if (skipSpaces && token.type() == TokenType.SPACE) {
                continue;
            }
            out.printf("%4d:%-6d %-20s %s%n", token.line(), token.pos(), token.type().name(), token);
        }
        out.flush();

        Token last = tokens.get(tokens.size() - 1);
        return last.type() == TokenType.ERROR ? 1 : 0;
    }
}
