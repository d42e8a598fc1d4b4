package com.ftlast.core.ast;

import java.util.Objects;

/**
 * Parse-time marker for {@code </#name>}. Tells the enclosing directive where its
 * content stops.
 */
public final class EndNode extends AbstractNode {

    private final String name;

    public EndNode(int position, TemplateSource source, String name) {
        super(NodeType.END, position, source);
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Returns the name of the directive being closed, e.g. {@code if}.
     *
     * @return closed directive name
     */
    public String name() {
        return name;
    }

    @Override
    public String render(TextFormat format) {
        return "</#" + name + ">";
    }

    @Override
    public EndNode copy() {
        return new EndNode(position(), source(), name);
    }
}
