package com.ftlast.core.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A term followed by one or more field accesses: {@code user.address.city}.
 *
 * <p>Field names are stored without their dots. {@code a.b.c} is one chain over
 * {@code a} with fields {@code b} and {@code c}.
 */
public final class ChainNode extends AbstractNode {

    private final Node base;
    private final List<String> fields = new ArrayList<>();

    public ChainNode(int position, TemplateSource source, Node base) {
        super(NodeType.CHAIN, position, source);
        this.base = Objects.requireNonNull(base, "base must not be null");
    }

    /**
     * Appends a field access to the end of the chain.
     *
     * @param field field name, without a leading dot
     * @throws IllegalArgumentException if the name is empty or contains a dot
     */
    public void addField(String field) {
        if (field == null || field.isEmpty()) {
            throw new IllegalArgumentException("empty field");
        }
        if (field.indexOf('.') >= 0) {
            throw new IllegalArgumentException("field must be a single name: " + field);
        }
        fields.add(field);
    }

    public Node base() {
        return base;
    }

    public List<String> fields() {
        return Collections.unmodifiableList(fields);
    }

    @Override
    public String render(TextFormat format) {
        StringBuilder sb = new StringBuilder();
        if (base instanceof ExpressionNode) {
            sb.append('(').append(base.render(format)).append(')');
        } else {
            sb.append(base.render(format));
        }
        for (String field : fields) {
            sb.append('.').append(field);
        }
        return sb.toString();
    }

    @Override
    public ChainNode copy() {
        ChainNode copy = new ChainNode(position(), source(), base.copy());
        fields.forEach(copy::addField);
        return copy;
    }
}
