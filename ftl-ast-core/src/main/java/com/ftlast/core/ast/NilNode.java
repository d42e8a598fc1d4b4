package com.ftlast.core.ast;

/**
 * The untyped {@code nil} constant.
 */
public final class NilNode extends AbstractNode {

    public NilNode(int position, TemplateSource source) {
        super(NodeType.NIL, position, source);
    }

    @Override
    public String render(TextFormat format) {
        return "nil";
    }

    @Override
    public NilNode copy() {
        return new NilNode(position(), source());
    }
}
