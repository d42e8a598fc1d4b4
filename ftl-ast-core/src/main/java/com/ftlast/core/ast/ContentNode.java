package com.ftlast.core.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered sequence of sibling nodes: the body of a template, branch or loop.
 */
public final class ContentNode extends AbstractNode {

    private final List<Node> nodes = new ArrayList<>();

    public ContentNode(int position, TemplateSource source) {
        super(NodeType.CONTENT, position, source);
    }

    /**
     * Appends a child. Only the parser calls this, while the content is being built.
     *
     * @param node child node in source order
     */
    public void append(Node node) {
        nodes.add(node);
    }

    /**
     * Returns the children in source order.
     *
     * @return unmodifiable view of the children
     */
    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    @Override
    public String render(TextFormat format) {
        StringBuilder sb = new StringBuilder();
        for (Node node : nodes) {
            sb.append(node.render(format));
        }
        return sb.toString();
    }

    @Override
    public ContentNode copy() {
        ContentNode copy = new ContentNode(position(), source());
        for (Node node : nodes) {
            copy.append(node.copy());
        }
        return copy;
    }
}
