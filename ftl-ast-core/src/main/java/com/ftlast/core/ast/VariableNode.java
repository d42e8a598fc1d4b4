package com.ftlast.core.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Variable bound by a directive, such as the loop variable of {@code <#list xs as x>}.
 *
 * <p>The name is kept as its dot-separated segments.
 */
public final class VariableNode extends AbstractNode {

    private final List<String> names;

    public VariableNode(int position, TemplateSource source, String name) {
        this(position, source, Arrays.asList(name.split("\\.", -1)));
    }

    private VariableNode(int position, TemplateSource source, List<String> names) {
        super(NodeType.VARIABLE, position, source);
        this.names = List.copyOf(names);
    }

    public List<String> names() {
        return names;
    }

    @Override
    public String render(TextFormat format) {
        return String.join(".", names);
    }

    @Override
    public VariableNode copy() {
        return new VariableNode(position(), source(), names);
    }
}
