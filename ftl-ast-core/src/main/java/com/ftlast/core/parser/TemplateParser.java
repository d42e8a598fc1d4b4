package com.ftlast.core.parser;

import com.ftlast.core.ast.ContentNode;
import com.ftlast.core.ast.ElseNode;
import com.ftlast.core.ast.EndNode;
import com.ftlast.core.ast.ExpressionNode;
import com.ftlast.core.ast.Node;
import com.ftlast.core.ast.VariableNode;
import com.ftlast.core.lexer.Lexer;
import com.ftlast.core.lexer.Token;
import com.ftlast.core.lexer.TokenType;
import com.ftlast.core.util.Quoting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Recursive-descent parser for template structure: text, interpolations and directives.
 *
 * <p>Reads tokens from a {@link Lexer} with up to three tokens of push-back and builds
 * nodes through the factories of the {@link Tree} being parsed. Expressions are
 * delegated to an {@link ExpressionParser} that shares this parser's token buffer.
 *
 * <p>Grammar, informally:
 * <pre>
 * template    := unit* EOF
 * unit        := TEXT | '${' expr '}' | directive | end
 * directive   := '&lt;#' ( if | else | elseif | list | include | macro ) '&gt;'
 * end         := '&lt;/#' NAME '&gt;'
 * if          := 'if' expr '&gt;' unit* [ ( else | elseif ) ... ] end
 * list        := 'list' expr 'as' NAME '&gt;' unit* [ else unit* ] end
 * </pre>
 * {@code macro} is only accepted at the top level.
 */
final class TemplateParser {

    private static final Logger log = LoggerFactory.getLogger(TemplateParser.class);

    private final Tree tree;
    private final Lexer lexer;
    private final Map<String, Tree> treeSet;
    private final ExpressionParser expressions;

    private final Token[] token = new Token[3];
    private int peekCount;

    /** Body of a directive together with the marker that ended it. */
    private record Branch(ContentNode content, Node terminator) {}

    /** Content and optional else content of an if or list. */
    private record Bodies(ContentNode content, ContentNode elseContent) {}

    TemplateParser(Tree tree, Lexer lexer, Map<String, Tree> treeSet) {
        this.tree = tree;
        this.lexer = lexer;
        this.treeSet = treeSet;
        this.expressions = new ExpressionParser(this, tree);
    }

    // Token buffer.

    Token next() throws ParseException {
        if (peekCount > 0) {
            peekCount--;
        } else {
            token[0] = pull();
        }
        return token[peekCount];
    }

    void backup() {
        peekCount++;
    }

    // token[0] is already in place.
    void backup2(Token t1) {
        token[1] = t1;
        peekCount = 2;
    }

    // token[0] is already in place; t2 comes out first.
    void backup3(Token t2, Token t1) {
        token[1] = t1;
        token[2] = t2;
        peekCount = 3;
    }

    Token peek() throws ParseException {
        if (peekCount > 0) {
            return token[peekCount - 1];
        }
        peekCount = 1;
        token[0] = pull();
        return token[0];
    }

    Token nextNonSpace() throws ParseException {
        Token t;
        do {
            t = next();
        } while (t.type() == TokenType.SPACE);
        return t;
    }

    Token peekNonSpace() throws ParseException {
        Token t = nextNonSpace();
        backup();
        return t;
    }

    private Token pull() throws ParseException {
        if (!lexer.hasNext()) {
            throw errorf("unexpected end of token stream");
        }
        Token t = lexer.next();
        if (t.type() == TokenType.ERROR) {
            token[0] = t;
            throw errorf("%s", t.value());
        }
        return t;
    }

    // Errors.

    /**
     * Builds a parse error located at the most recently read token.
     */
    ParseException errorf(String format, Object... args) {
        Token current = token[0];
        int line = current == null ? 1 : current.line();
        int column = current == null ? 0 : tree.source().columnOf(current.pos());
        String context = current == null ? "" : current.toString();
        return new ParseException(tree.parseName(), line, column, String.format(format, args), context);
    }

    ParseException unexpected(Token t, String context) {
        return errorf("unexpected %s in %s", t, context);
    }

    Token expect(TokenType expected, String context) throws ParseException {
        Token t = nextNonSpace();
        if (t.type() != expected) {
            throw unexpected(t, context);
        }
        return t;
    }

    Token expectOneOf(TokenType expected1, TokenType expected2, String context) throws ParseException {
        Token t = nextNonSpace();
        if (t.type() != expected1 && t.type() != expected2) {
            throw unexpected(t, context);
        }
        return t;
    }

    // Structure.

    /**
     * Parses the whole input. Definitions are installed into the tree set and
     * left out of the returned content.
     */
    ContentNode parse() throws ParseException {
        ContentNode root = tree.newContent(peek().pos());
        while (peek().type() != TokenType.EOF) {
            if (peek().type() == TokenType.START_DIRECTIVE && atDefinition()) {
                parseDefinition();
                continue;
            }
            Node n = textOrDirective();
            if (n.type().isMarker()) {
                throw errorf("unexpected %s", n);
            }
            root.append(n);
        }
        return root;
    }

    /**
     * Installs a parsed tree under its name. An empty existing tree is replaced, an
     * empty new tree is dropped, and two non-empty trees of one name are an error.
     */
    void install(Tree t) throws ParseException {
        Tree existing = treeSet.get(t.name());
        if (existing == null || Tree.isEmptyTree(existing.root())) {
            treeSet.put(t.name(), t);
            return;
        }
        if (!Tree.isEmptyTree(t.root())) {
            throw errorf("multiple definition of template %s", Quoting.quote(t.name()));
        }
        log.debug("Ignoring empty redefinition of template {}", t.name());
    }

    // Consumes "<#" and "macro" if they come next; otherwise leaves the stream untouched.
    private boolean atDefinition() throws ParseException {
        Token delim = next();
        Token keyword = next();
        if (keyword.type() == TokenType.SPACE) {
            Token afterSpace = next();
            if (afterSpace.type() == TokenType.MACRO) {
                return true;
            }
            backup3(delim, keyword);
            return false;
        }
        if (keyword.type() == TokenType.MACRO) {
            return true;
        }
        backup2(delim);
        return false;
    }

    // <#macro "name">...</#macro> or <#macro name>...</#macro>; "<#macro" is past.
    private void parseDefinition() throws ParseException {
        final String context = "macro definition";
        Token nameToken = expectOneOf(TokenType.STRING_CONSTANT, TokenType.IDENTIFIER, context);
        String name = nameToken.type() == TokenType.STRING_CONSTANT
            ? templateName(nameToken)
            : nameToken.value();
        expect(TokenType.CLOSE_DIRECTIVE, context);

        Branch body = itemContent();
        if (!(body.terminator() instanceof EndNode end)) {
            throw errorf("unexpected %s in %s", body.terminator(), context);
        }
        checkEnd(end, "macro");

        Tree definition = Tree.definition(name, tree.source(), body.content());
        install(definition);
        log.debug("Installed definition {} from template {}", name, tree.parseName());
    }

    // Runs to the next End or Else marker and returns it with the content before it.
    private Branch itemContent() throws ParseException {
        ContentNode content = tree.newContent(peekNonSpace().pos());
        while (peekNonSpace().type() != TokenType.EOF) {
            Node n = textOrDirective();
            if (n.type().isMarker()) {
                return new Branch(content, n);
            }
            content.append(n);
        }
        throw errorf("unexpected EOF");
    }

    private Node textOrDirective() throws ParseException {
        Token t = nextNonSpace();
        return switch (t.type()) {
            case TEXT -> tree.newText(t.pos(), t.value());
            case LEFT_INTERPOLATION -> expressions.parse("interpolation", TokenType.RIGHT_INTERPOLATION);
            case START_DIRECTIVE -> directive();
            case END_DIRECTIVE -> endDirective(t);
            default -> throw unexpected(t, "input");
        };
    }

    // "<#" is past.
    private Node directive() throws ParseException {
        Token t = nextNonSpace();
        return switch (t.type()) {
            case IF -> ifControl();
            case ELSE -> elseControl(t);
            case ELSEIF -> tree.newElse(t.pos(), true);
            case LIST -> listControl(t);
            case INCLUDE -> includeDirective(t);
            default -> throw unexpected(t, "directive");
        };
    }

    // "</#" is past.
    private EndNode endDirective(Token start) throws ParseException {
        final String context = "end directive";
        Token name = nextNonSpace();
        if (name.type() != TokenType.IDENTIFIER && !name.type().isDirective()) {
            throw unexpected(name, context);
        }
        expect(TokenType.CLOSE_DIRECTIVE, context);
        return tree.newEnd(start.pos(), name.value());
    }

    // "<#if" is past.
    private Node ifControl() throws ParseException {
        ExpressionNode condition = expressions.parse("if", TokenType.CLOSE_DIRECTIVE);
        Bodies bodies = parseBodies(true, "if");
        return tree.newIf(condition.position(), condition, bodies.content(), bodies.elseContent());
    }

    // "<#list" is past.
    private Node listControl(Token keyword) throws ParseException {
        final String context = "list";
        ExpressionNode sequence = expressions.parse(context, TokenType.AS);
        Token name = expect(TokenType.IDENTIFIER, context);
        expect(TokenType.CLOSE_DIRECTIVE, context);
        VariableNode variable = tree.newVariable(name.pos(), name.value());

        Bodies bodies = parseBodies(false, context);
        return tree.newList(keyword.pos(), sequence, variable, bodies.content(), bodies.elseContent());
    }

    // "<#else" is past.
    private Node elseControl(Token keyword) throws ParseException {
        Token peeked = peekNonSpace();
        if (peeked.type() == TokenType.IF) {
            // <#else if c> is read as <#else><#if c>; the "if" stays pending
            return tree.newElse(peeked.pos(), false);
        }
        expect(TokenType.CLOSE_DIRECTIVE, "else");
        return tree.newElse(keyword.pos(), false);
    }

    // "<#include" is past.
    private Node includeDirective(Token keyword) throws ParseException {
        final String context = "include";
        Token name = expect(TokenType.STRING_CONSTANT, context);
        expect(TokenType.CLOSE_DIRECTIVE, context);
        return tree.newInclude(keyword.pos(), templateName(name));
    }

    /**
     * Parses the content of an if or list, its optional else branch, and the closing
     * end marker.
     *
     * <p>With else-if chaining allowed, an else followed by {@code if} (or an
     * {@code elseif} marker) becomes an else branch holding exactly one nested if.
     * The nested if consumes the single end marker of the whole chain.
     */
    private Bodies parseBodies(boolean allowElseIf, String context) throws ParseException {
        Branch body = itemContent();
        Node next = body.terminator();
        ContentNode elseContent = null;

        if (next instanceof ElseNode marker) {
            if (allowElseIf && (marker.chained() || peek().type() == TokenType.IF)) {
                if (!marker.chained()) {
                    next();
                }
                elseContent = tree.newContent(marker.position());
                elseContent.append(ifControl());
                return new Bodies(body.content(), elseContent);
            }
            if (marker.chained() || peek().type() == TokenType.IF) {
                throw errorf("unexpected %s in %s", marker, context);
            }
            Branch elseBody = itemContent();
            next = elseBody.terminator();
            if (!(next instanceof EndNode)) {
                throw errorf("expected end; found %s", next);
            }
            elseContent = elseBody.content();
        }

        checkEnd((EndNode) next, context);
        return new Bodies(body.content(), elseContent);
    }

    private void checkEnd(EndNode end, String directive) throws ParseException {
        if (!end.name().equals(directive)) {
            throw errorf("expected </#%s>; found %s", directive, end);
        }
    }

    private String templateName(Token t) throws ParseException {
        try {
            return Quoting.unquote(t.value());
        } catch (IllegalArgumentException e) {
            throw errorf("%s", e.getMessage());
        }
    }
}
