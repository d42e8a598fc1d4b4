package com.ftlast.core.parser;

import com.ftlast.core.ast.BoolNode;
import com.ftlast.core.ast.ChainNode;
import com.ftlast.core.ast.ContentNode;
import com.ftlast.core.ast.ElseNode;
import com.ftlast.core.ast.EndNode;
import com.ftlast.core.ast.ExpressionNode;
import com.ftlast.core.ast.IdentifierNode;
import com.ftlast.core.ast.IfNode;
import com.ftlast.core.ast.IncludeNode;
import com.ftlast.core.ast.ListNode;
import com.ftlast.core.ast.NilNode;
import com.ftlast.core.ast.Node;
import com.ftlast.core.ast.NumberNode;
import com.ftlast.core.ast.StringNode;
import com.ftlast.core.ast.TemplateSource;
import com.ftlast.core.ast.TextFormat;
import com.ftlast.core.ast.TextNode;
import com.ftlast.core.ast.VariableNode;
import com.ftlast.core.lexer.Lexer;
import com.ftlast.core.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Parsed representation of one named template.
 *
 * <p>A tree is created with {@link #create(String)} and populated by exactly one call to
 * {@link #parse(String, Map)}. Definitions found in the source ({@code <#macro name>})
 * become trees of their own and are installed into the map passed to {@code parse}, next
 * to the top-level tree. The map belongs to the caller; a tree never keeps it after the
 * parse returns.
 *
 * <p>All nodes are created through this class, so every node of a parse references the
 * same {@link TemplateSource}. That reference is what {@link #errorContext(Node)} resolves
 * positions against, for the original tree and for its copies alike.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * Map<String, Tree> trees = new HashMap<>();
 * Tree tree = Tree.create("page").parse("Hello ${user.name}!", trees);
 *
 * System.out.println(tree.root());                      // Hello user.name!
 * ErrorContext where = tree.errorContext(tree.root().nodes().get(1));
 * System.out.println(where.location());                 // page:1:8
 * }</pre>
 */
public final class Tree {

    private static final Logger log = LoggerFactory.getLogger(Tree.class);

    /** Default maximum length of an error context snippet. */
    public static final int DEFAULT_CONTEXT_LENGTH = 20;

    private final String name;
    private String parseName;
    private ContentNode root;
    private TemplateSource source;

    private Tree(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Creates an empty tree. It has no root until {@link #parse(String, Map)} succeeds.
     *
     * @param name template name
     * @return new unparsed tree
     */
    public static Tree create(String name) {
        return new Tree(name);
    }

    // Definition bodies share the source of the tree they were found in.
    static Tree definition(String name, TemplateSource source, ContentNode root) {
        Tree tree = new Tree(name);
        tree.parseName = source.parseName();
        tree.source = source;
        tree.root = root;
        return tree;
    }

    /**
     * Parses template source into this tree.
     *
     * <p>On success the tree and every definition in the source are installed into
     * {@code treeSet}. On failure the scanner is drained, the root is discarded and
     * the first error is thrown; the map may hold definitions parsed before the error.
     *
     * @param text template source
     * @param treeSet shared map from template name to tree, updated in place
     * @return this tree
     * @throws ParseException if the source cannot be scanned or parsed, or a
     *         non-empty template of the same name is already defined
     */
    public Tree parse(String text, Map<String, Tree> treeSet) throws ParseException {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(treeSet, "treeSet must not be null");

        parseName = name;
        source = new TemplateSource(parseName, text);
        root = null;

        log.debug("Parsing template {} ({} chars)", name, text.length());
        Lexer lexer = new Lexer(name, text);
        TemplateParser parser = new TemplateParser(this, lexer, treeSet);
        try {
            root = parser.parse();
            parser.install(this);
        } catch (ParseException e) {
            lexer.drain();
            root = null;
            throw e;
        }
        log.debug("Parsed template {} into {} top-level nodes", name, root.nodes().size());
        return this;
    }

    /**
     * Copies this tree. Nodes are deep copied; the source reference is shared.
     *
     * @return structural copy with no parse state
     */
    public Tree copy() {
        Tree copy = new Tree(name);
        copy.parseName = parseName;
        copy.source = source;
        copy.root = root == null ? null : root.copy();
        return copy;
    }

    /**
     * Reports whether a node holds nothing but whitespace text.
     *
     * <p>Directives and interpolations make a tree non-empty. Comments never
     * reach the tree and so never count.
     *
     * @param node node to check, may be {@code null}
     * @return true if {@code node} is {@code null} or only contains blank text
     * @throws IllegalStateException if a node variant that cannot occur in content is found
     */
    public static boolean isEmptyTree(Node node) {
        if (node == null) {
            return true;
        }
        return switch (node.type()) {
            case CONTENT -> ((ContentNode) node).nodes().stream().allMatch(Tree::isEmptyTree);
            case TEXT -> ((TextNode) node).text().isBlank();
            case IF, LIST, INCLUDE, EXPRESSION -> false;
            default -> throw new IllegalStateException("unknown node: " + node);
        };
    }

    /**
     * Describes where a node is, using {@link #DEFAULT_CONTEXT_LENGTH}.
     *
     * @param node node to locate
     * @return location and context snippet
     * @see #errorContext(Node, int)
     */
    public ErrorContext errorContext(Node node) {
        return errorContext(node, DEFAULT_CONTEXT_LENGTH);
    }

    /**
     * Describes where a node is: {@code parseName:line:column} and a snippet of its raw rendering.
     *
     * <p>The node's own source is used; this tree's source is the fallback for a
     * node that carries none. The column is the offset from the start of the line.
     *
     * @param node node to locate
     * @param maxContextLength snippets longer than this are cut and suffixed with {@code ...}
     * @return location and context snippet
     */
    public ErrorContext errorContext(Node node, int maxContextLength) {
        TemplateSource src = node.source() != null ? node.source() : source;
        if (src == null) {
            throw new IllegalStateException("template " + name + " has not been parsed");
        }
        int pos = node.position();
        String location = String.format("%s:%d:%d", src.parseName(), src.lineOf(pos), src.columnOf(pos));

        String context = node.render(TextFormat.RAW);
        if (context.codePointCount(0, context.length()) > maxContextLength) {
            context = context.substring(0, context.offsetByCodePoints(0, maxContextLength)) + "...";
        }
        return new ErrorContext(location, context);
    }

    public String name() {
        return name;
    }

    /**
     * Returns the name of the top-level template this tree was parsed from.
     *
     * @return parse name, or {@code null} before parsing
     */
    public String parseName() {
        return parseName;
    }

    /**
     * Returns the root content.
     *
     * @return root, or {@code null} if the tree is unparsed or its parse failed
     */
    public ContentNode root() {
        return root;
    }

    /**
     * Returns the retained source text.
     *
     * @return source text, or {@code null} before parsing
     */
    public String text() {
        return source == null ? null : source.text();
    }

    public TemplateSource source() {
        return source;
    }

    @Override
    public String toString() {
        return root == null ? "" : root.render(TextFormat.RAW);
    }

    // Node factories used by the parsers.

    ContentNode newContent(int pos) {
        return new ContentNode(pos, source);
    }

    TextNode newText(int pos, String text) {
        return new TextNode(pos, source, text);
    }

    ExpressionNode newExpression(int pos, TokenType operator) {
        return new ExpressionNode(pos, source, operator);
    }

    IdentifierNode newIdentifier(int pos, String identifier) {
        return new IdentifierNode(pos, source, identifier);
    }

    VariableNode newVariable(int pos, String identifier) {
        return new VariableNode(pos, source, identifier);
    }

    NilNode newNil(int pos) {
        return new NilNode(pos, source);
    }

    ChainNode newChain(int pos, Node base) {
        return new ChainNode(pos, source, base);
    }

    BoolNode newBool(int pos, boolean value) {
        return new BoolNode(pos, source, value);
    }

    NumberNode newNumber(int pos, String text, TokenType type) {
        return NumberNode.parse(pos, source, text, type);
    }

    StringNode newString(int pos, String quoted, String value) {
        return new StringNode(pos, source, quoted, value);
    }

    IfNode newIf(int pos, ExpressionNode condition, ContentNode content, ContentNode elseContent) {
        return new IfNode(pos, source, condition, content, elseContent);
    }

    ListNode newList(int pos, ExpressionNode sequence, VariableNode variable,
                     ContentNode content, ContentNode elseContent) {
        return new ListNode(pos, source, sequence, variable, content, elseContent);
    }

    IncludeNode newInclude(int pos, String templateName) {
        return new IncludeNode(pos, source, templateName);
    }

    EndNode newEnd(int pos, String directive) {
        return new EndNode(pos, source, directive);
    }

    ElseNode newElse(int pos, boolean chained) {
        return new ElseNode(pos, source, chained);
    }
}
