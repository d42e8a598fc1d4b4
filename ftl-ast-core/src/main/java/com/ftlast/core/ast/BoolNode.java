package com.ftlast.core.ast;

/**
 * Boolean constant {@code true} or {@code false}.
 */
public final class BoolNode extends AbstractNode {

    private final boolean value;

    public BoolNode(int position, TemplateSource source, boolean value) {
        super(NodeType.BOOL, position, source);
        this.value = value;
    }

    public boolean value() {
        return value;
    }

    @Override
    public String render(TextFormat format) {
        return value ? "true" : "false";
    }

    @Override
    public BoolNode copy() {
        return new BoolNode(position(), source(), value);
    }
}
