package com.ftlast.core.ast;

import java.util.Objects;

/**
 * Literal template text. May span newlines.
 */
public final class TextNode extends AbstractNode {

    private final String text;

    public TextNode(int position, TemplateSource source, String text) {
        super(NodeType.TEXT, position, source);
        this.text = Objects.requireNonNull(text, "text must not be null");
    }

    public String text() {
        return text;
    }

    @Override
    public String render(TextFormat format) {
        return format.format(text);
    }

    @Override
    public TextNode copy() {
        return new TextNode(position(), source(), text);
    }
}
