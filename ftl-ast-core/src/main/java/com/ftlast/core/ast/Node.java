package com.ftlast.core.ast;

/**
 * Element of a parsed template tree.
 *
 * <p>Nodes are built by the parser while a template is parsed and are not modified
 * afterwards. {@link #toString()} is the raw rendering; {@link #render(TextFormat)}
 * reconstructs the node's surface syntax.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * Tree tree = Tree.create("page").parse("<#if a>x</#if>", new HashMap<>());
 * for (Node node : tree.root().nodes()) {
 *     if (node.type() == NodeType.IF) {
 *         System.out.println(node.render(TextFormat.QUOTED));   // <#if a>"x"</#if>
 *     }
 * }
 * }</pre>
 */
public interface Node {

    NodeType type();

    /**
     * Returns the offset of the first character of this node in its source text.
     *
     * @return source offset
     */
    int position();

    /**
     * Returns the source this node was parsed from.
     *
     * @return source reference, shared with the owning tree and its copies
     */
    TemplateSource source();

    /**
     * Reconstructs the surface syntax of this node and its children.
     *
     * @param format how literal text is written
     * @return reconstructed template fragment
     */
    String render(TextFormat format);

    /**
     * Deep copies this node. The copy shares no mutable state with the original.
     *
     * @return copy of this node and all of its children
     */
    Node copy();
}
