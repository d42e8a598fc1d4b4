package com.ftlast.core.ast;

import java.util.Objects;

/**
 * Reference to a name in the data model.
 */
public final class IdentifierNode extends AbstractNode {

    private final String name;

    public IdentifierNode(int position, TemplateSource source, String name) {
        super(NodeType.IDENTIFIER, position, source);
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String name() {
        return name;
    }

    @Override
    public String render(TextFormat format) {
        return name;
    }

    @Override
    public IdentifierNode copy() {
        return new IdentifierNode(position(), source(), name);
    }
}
