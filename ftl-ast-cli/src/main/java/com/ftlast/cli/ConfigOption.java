package com.ftlast.cli;

import com.ftlast.core.config.ConfigLoader;
import com.ftlast.core.config.ParserConfig;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Mixin adding the {@code --config} option to a command.
 *
 * <p>An explicitly given file is always loaded and a problem with it is logged.
 * Without the option, {@code ftl-ast.yaml} in the working directory is used if present.
 */
public class ConfigOption {

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: " + ConfigLoader.DEFAULT_FILE_NAME + " if present)"
    )
    private Path configPath;

    /**
     * Loads the selected configuration.
     *
     * @return configuration, or defaults if none is available
     */
    public ParserConfig load() {
        if (configPath != null) {
            return ConfigLoader.load(configPath);
        }
        Path defaultPath = Path.of(ConfigLoader.DEFAULT_FILE_NAME);
        return Files.exists(defaultPath) ? ConfigLoader.load(defaultPath) : ParserConfig.defaults();
    }
}
