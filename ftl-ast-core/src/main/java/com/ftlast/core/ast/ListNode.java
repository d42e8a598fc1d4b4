package com.ftlast.core.ast;

import java.util.Objects;

/**
 * {@code <#list items as item>...[<#else>...]</#list>}.
 *
 * <p>The else content is rendered instead of the body when the sequence is empty.
 */
public final class ListNode extends AbstractNode {

    private final ExpressionNode sequence;
    private final VariableNode variable;
    private final ContentNode content;
    private final ContentNode elseContent;

    /**
     * Creates a list node.
     *
     * @param position source offset
     * @param source source reference
     * @param sequence expression producing the sequence
     * @param variable loop variable bound for each item
     * @param content loop body
     * @param elseContent content for an empty sequence, or {@code null}
     */
    public ListNode(int position, TemplateSource source, ExpressionNode sequence, VariableNode variable,
                    ContentNode content, ContentNode elseContent) {
        super(NodeType.LIST, position, source);
        this.sequence = Objects.requireNonNull(sequence, "sequence must not be null");
        this.variable = Objects.requireNonNull(variable, "variable must not be null");
        this.content = Objects.requireNonNull(content, "content must not be null");
        this.elseContent = elseContent;
    }

    public ExpressionNode sequence() {
        return sequence;
    }

    public VariableNode variable() {
        return variable;
    }

    public ContentNode content() {
        return content;
    }

    public ContentNode elseContent() {
        return elseContent;
    }

    @Override
    public String render(TextFormat format) {
        StringBuilder sb = new StringBuilder("<#list ")
            .append(sequence.render(format))
            .append(" as ")
            .append(variable.render(format))
            .append('>')
            .append(content.render(format));
        if (elseContent != null) {
            sb.append("<#else>").append(elseContent.render(format));
        }
        return sb.append("</#list>").toString();
    }

    @Override
    public ListNode copy() {
        return new ListNode(position(), source(), sequence.copy(), variable.copy(), content.copy(),
            elseContent == null ? null : elseContent.copy());
    }
}
