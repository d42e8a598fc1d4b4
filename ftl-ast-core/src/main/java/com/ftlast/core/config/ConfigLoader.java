package com.ftlast.core.config;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading the tool configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code ftl-ast.yaml} into a {@link ParserConfig} record.
 * If the file is missing or invalid, returns {@link ParserConfig#defaults()}.
 * Enum values such as {@code textFormat} are matched case-insensitively.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ParserConfig config = ConfigLoader.load(Path.of(ConfigLoader.DEFAULT_FILE_NAME));
 * String extension = config.templates().extension();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /** File name looked up in the working directory when no path is given. */
    public static final String DEFAULT_FILE_NAME = "ftl-ast.yaml";

    private static final ObjectMapper YAML_MAPPER = YAMLMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .build();

    private ConfigLoader() {
        // Utility class - no instantiation
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link ParserConfig#defaults()}.
     *
     * @param configPath path to {@code ftl-ast.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ParserConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return ParserConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ParserConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ParserConfig config = YAML_MAPPER.readValue(configPath.toFile(), ParserConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ParserConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ParserConfig.defaults();
        }
    }
}
