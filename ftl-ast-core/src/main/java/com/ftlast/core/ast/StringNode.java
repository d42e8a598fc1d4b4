package com.ftlast.core.ast;

import java.util.Objects;

/**
 * String constant. Keeps both the quoted lexeme and the value after escape processing.
 */
public final class StringNode extends AbstractNode {

    private final String quoted;
    private final String value;

    /**
     * Creates a string constant.
     *
     * @param position source offset
     * @param source source reference
     * @param quoted literal as written, including quotes
     * @param value unquoted value
     */
    public StringNode(int position, TemplateSource source, String quoted, String value) {
        super(NodeType.STRING, position, source);
        this.quoted = Objects.requireNonNull(quoted, "quoted must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public String quoted() {
        return quoted;
    }

    public String value() {
        return value;
    }

    @Override
    public String render(TextFormat format) {
        return quoted;
    }

    @Override
    public StringNode copy() {
        return new StringNode(position(), source(), quoted, value);
    }
}
