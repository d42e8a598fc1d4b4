package com.ftlast.core.ast;

import java.util.Objects;

/**
 * Source text a node was parsed from, with the name of the top-level template.
 *
 * <p>Shared by a tree, every node it created, and every copy of either. Error
 * reporting resolves node positions to lines and columns against it.
 *
 * @param parseName name of the top-level template being parsed
 * @param text full source text
 */
public record TemplateSource(String parseName, String text) {

    public TemplateSource {
        Objects.requireNonNull(parseName, "parseName must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Returns the 1-based line of a position.
     *
     * @param pos offset into {@link #text()}
     * @return 1 plus the number of newlines before {@code pos}
     */
    public int lineOf(int pos) {
        int line = 1;
        for (int i = 0; i < pos; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    /**
     * Returns the column of a position, counted from 0 at the start of its line.
     *
     * @param pos offset into {@link #text()}
     * @return offset of {@code pos} from the character after the previous newline
     */
    public int columnOf(int pos) {
        int lastNewline = pos == 0 ? -1 : text.lastIndexOf('\n', pos - 1);
        return pos - (lastNewline + 1);
    }
}
