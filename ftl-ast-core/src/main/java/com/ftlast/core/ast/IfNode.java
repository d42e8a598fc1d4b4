package com.ftlast.core.ast;

import java.util.Objects;

/**
 * {@code <#if cond>...[<#elseif cond>...][<#else>...]</#if>}.
 *
 * <p>An {@code elseif} chain is stored as nesting: the else content of the outer
 * node holds exactly one inner {@code IfNode}. Such else content renders back as
 * {@code <#elseif>}, so {@code <#elseif c>} and {@code <#else if c>} produce the
 * same tree and the same rendering.
 */
public final class IfNode extends AbstractNode {

    private final ExpressionNode condition;
    private final ContentNode content;
    private final ContentNode elseContent;

    /**
     * Creates an if node.
     *
     * @param position source offset
     * @param source source reference
     * @param condition condition expression
     * @param content content rendered when the condition holds
     * @param elseContent else branch, or {@code null} if there is none
     */
    public IfNode(int position, TemplateSource source, ExpressionNode condition,
                  ContentNode content, ContentNode elseContent) {
        super(NodeType.IF, position, source);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
        this.content = Objects.requireNonNull(content, "content must not be null");
        this.elseContent = elseContent;
    }

    public ExpressionNode condition() {
        return condition;
    }

    public ContentNode content() {
        return content;
    }

    /**
     * Returns the else branch.
     *
     * @return else content, or {@code null} when the directive has no else branch
     */
    public ContentNode elseContent() {
        return elseContent;
    }

    /**
     * Returns the nested if of an {@code elseif} branch.
     *
     * @return the single if node in the else content, or {@code null}
     */
    public IfNode elseIf() {
        if (elseContent != null && elseContent.nodes().size() == 1
            && elseContent.nodes().get(0) instanceof IfNode nested) {
            return nested;
        }
        return null;
    }

    @Override
    public String render(TextFormat format) {
        StringBuilder sb = new StringBuilder("<#if ");
        appendBranches(sb, format);
        return sb.append("</#if>").toString();
    }

    private void appendBranches(StringBuilder sb, TextFormat format) {
        sb.append(condition.render(format)).append('>').append(content.render(format));
        IfNode nested = elseIf();
        if (nested != null) {
            sb.append("<#elseif ");
            nested.appendBranches(sb, format);
        } else if (elseContent != null) {
            sb.append("<#else>").append(elseContent.render(format));
        }
    }

    @Override
    public IfNode copy() {
        return new IfNode(position(), source(), condition.copy(), content.copy(),
            elseContent == null ? null : elseContent.copy());
    }
}
