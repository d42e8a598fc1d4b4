package com.ftlast.core.ast;

import com.ftlast.core.util.Quoting;

/**
 * How {@link TextNode} content is written when a tree is rendered back to source form.
 */
public enum TextFormat {
    /** Text is written verbatim; rendering reproduces the template source */
    RAW,
    /** Text is written as a quoted, escaped literal; used in diagnostics and tests */
    QUOTED;

    /**
     * Formats a run of template text.
     *
     * @param text literal template text
     * @return text as it appears in rendered output
     */
    public String format(String text) {
        return this == QUOTED ? Quoting.quote(text) : text;
    }
}
