package com.ftlast.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ftlast.core.ast.TextFormat;
import com.ftlast.core.parser.Tree;

/**
 * Root configuration of the template tools.
 *
 * <p>Loaded from {@code ftl-ast.yaml}. Sections missing from the file take their defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * diagnostics:
 *   textFormat: quoted
 *   contextLength: 20
 *
 * templates:
 *   extension: ftl
 *   failFast: false
 * }</pre>
 *
 * @param diagnostics how trees and errors are printed
 * @param templates how template files are found and checked
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParserConfig(
    @JsonProperty("diagnostics") Diagnostics diagnostics,
    @JsonProperty("templates") Templates templates
) {
    public ParserConfig {
        if (diagnostics == null) {
            diagnostics = Diagnostics.defaults();
        }
        if (templates == null) {
            templates = Templates.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static ParserConfig defaults() {
        return new ParserConfig(Diagnostics.defaults(), Templates.defaults());
    }

    /**
     * Diagnostic output settings.
     *
     * @param textFormat how template text is written when a tree is printed
     * @param contextLength maximum length of error context snippets
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Diagnostics(
        @JsonProperty("textFormat") TextFormat textFormat,
        @JsonProperty("contextLength") int contextLength
    ) {
        public Diagnostics {
            if (textFormat == null) {
                textFormat = TextFormat.QUOTED;
            }
            if (contextLength <= 0) {
                contextLength = Tree.DEFAULT_CONTEXT_LENGTH;
            }
        }

        public static Diagnostics defaults() {
            return new Diagnostics(TextFormat.QUOTED, Tree.DEFAULT_CONTEXT_LENGTH);
        }
    }

    /**
     * Template file settings.
     *
     * @param extension file extension of templates, without the dot
     * @param failFast stop checking at the first template that fails to parse
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Templates(
        @JsonProperty("extension") String extension,
        @JsonProperty("failFast") boolean failFast
    ) {
        public Templates {
            if (extension == null || extension.isBlank()) {
                extension = "ftl";
            } else if (extension.startsWith(".")) {
                extension = extension.substring(1);
            }
        }

        public static Templates defaults() {
            return new Templates("ftl", false);
        }
    }
}
