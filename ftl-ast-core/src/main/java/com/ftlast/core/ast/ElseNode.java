package com.ftlast.core.ast;

/**
 * Parse-time marker for {@code <#else>} or {@code <#elseif>}.
 *
 * <p>A chained marker comes from {@code <#elseif cond>}; the condition that follows
 * is still pending in the token stream, as it is after {@code <#else if cond>}.
 */
public final class ElseNode extends AbstractNode {

    private final boolean chained;

    public ElseNode(int position, TemplateSource source, boolean chained) {
        super(NodeType.ELSE, position, source);
        this.chained = chained;
    }

    public boolean chained() {
        return chained;
    }

    @Override
    public String render(TextFormat format) {
        return chained ? "<#elseif>" : "<#else>";
    }

    @Override
    public ElseNode copy() {
        return new ElseNode(position(), source(), chained);
    }
}
