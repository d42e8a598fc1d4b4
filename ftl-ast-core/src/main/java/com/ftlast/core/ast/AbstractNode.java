package com.ftlast.core.ast;

import java.util.Objects;

/**
 * Base class holding the state every node carries: its tag, position and source.
 */
public abstract class AbstractNode implements Node {

    private final NodeType type;
    private final int position;
    private final TemplateSource source;

    protected AbstractNode(NodeType type, int position, TemplateSource source) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.position = position;
        this.source = source;
    }

    @Override
    public final NodeType type() {
        return type;
    }

    @Override
    public final int position() {
        return position;
    }

    @Override
    public final TemplateSource source() {
        return source;
    }

    @Override
    public String toString() {
        return render(TextFormat.RAW);
    }
}
