package com.ftlast.core.parser;

import com.ftlast.core.ast.ChainNode;
import com.ftlast.core.ast.ExpressionNode;
import com.ftlast.core.ast.IdentifierNode;
import com.ftlast.core.ast.Node;
import com.ftlast.core.lexer.Token;
import com.ftlast.core.lexer.TokenType;
import com.ftlast.core.util.Quoting;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Operator-precedence parser for expressions inside interpolations and directives.
 *
 * <p>Works with two stacks. The operator stack starts with a sentinel of the lowest
 * precedence; operands are pushed as leaf nodes. An incoming operator is pushed when
 * the top of the operator stack is the sentinel or the incoming precedence is greater
 * than or equal to the top's. Otherwise the top operator is reduced with the two top
 * operands and the incoming operator is read again. At the closing token every
 * operator but one is reduced, and the last one is combined into the result.
 *
 * <p>Reducing pops the right operand first and appends operands in pop order, so the
 * result of {@code a == b} holds {@code [b, a]}.
 *
 * <p>Field access ({@code .}) has the highest precedence and, unlike the other
 * operators, binds left to right: {@code a.b.c} is one {@link ChainNode}.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * // after "<#if" has been read
 * ExpressionNode condition = expressions.parse("if", TokenType.CLOSE_DIRECTIVE);
 * }</pre>
 */
final class ExpressionParser {

    private final TemplateParser parser;
    private final Tree tree;

    ExpressionParser(TemplateParser parser, Tree tree) {
        this.parser = parser;
        this.tree = tree;
    }

    /**
     * Parses tokens up to and including {@code closer}.
     *
     * @param context what is being parsed, for error messages (e.g. {@code if})
     * @param closer token type ending the expression
     * @return parsed expression; a single operand is wrapped unless it is an expression already
     * @throws ParseException on an unexpected token, a missing operand or a malformed literal
     */
    ExpressionNode parse(String context, TokenType closer) throws ParseException {
        Token first = parser.peekNonSpace();
        Deque<Token> operators = new ArrayDeque<>();
        Deque<Node> operands = new ArrayDeque<>();
        operators.push(new Token(TokenType.LOWEST_PREC, first.pos(), TokenType.LOWEST_PREC.toString(), first.line()));
        boolean expectOperand = true;

        while (true) {
            Token t = parser.nextNonSpace();
            TokenType type = t.type();

            if (type == closer) {
                if (operands.isEmpty()) {
                    throw parser.errorf("missing value for %s", context);
                }
                if (expectOperand) {
                    throw parser.unexpected(t, context);
                }
                return finish(first, operators, operands, context);
            }

            if (type == TokenType.LEFT_PAREN) {
                if (!expectOperand) {
                    throw parser.unexpected(t, context);
                }
                operands.push(parse(context, TokenType.RIGHT_PAREN));
                expectOperand = false;
            } else if (isOperand(type)) {
                if (!expectOperand) {
                    throw parser.unexpected(t, context);
                }
                operands.push(operand(t));
                expectOperand = false;
            } else if (type.isOperator() && type != TokenType.LOWEST_PREC) {
                if (expectOperand) {
                    throw parser.unexpected(t, context);
                }
                Token top = operators.peek();
                if (shouldPush(type, top.type())) {
                    operators.push(t);
                    expectOperand = true;
                } else {
                    reduce(operators, operands, context);
                    parser.backup();
                }
            } else {
                throw parser.unexpected(t, context);
            }
        }
    }

    private static boolean shouldPush(TokenType incoming, TokenType top) {
        if (top == TokenType.LOWEST_PREC) {
            return true;
        }
        if (incoming == TokenType.DOT && top == TokenType.DOT) {
            return false;
        }
        return incoming.precedence() >= top.precedence();
    }

    private static boolean isOperand(TokenType type) {
        return switch (type) {
            case BOOL, CHAR_CONSTANT, NUMBER, IDENTIFIER, STRING_CONSTANT -> true;
            default -> false;
        };
    }

    private Node operand(Token t) throws ParseException {
        return switch (t.type()) {
            case BOOL -> tree.newBool(t.pos(), t.value().equals("true"));
            case IDENTIFIER -> t.value().equals("nil")
                ? tree.newNil(t.pos())
                : tree.newIdentifier(t.pos(), t.value());
            case CHAR_CONSTANT, NUMBER -> number(t);
            case STRING_CONSTANT -> string(t);
            default -> throw new IllegalArgumentException("not an operand: " + t.type());
        };
    }

    private Node number(Token t) throws ParseException {
        try {
            return tree.newNumber(t.pos(), t.value(), t.type());
        } catch (NumberFormatException e) {
            throw parser.errorf("%s", e.getMessage());
        }
    }

    private Node string(Token t) throws ParseException {
        try {
            return tree.newString(t.pos(), t.value(), Quoting.unquote(t.value()));
        } catch (IllegalArgumentException e) {
            throw parser.errorf("%s", e.getMessage());
        }
    }

    // Reduces all but one operator, then combines the last one into the result.
    private ExpressionNode finish(Token first, Deque<Token> operators, Deque<Node> operands, String context)
            throws ParseException {
        while (operators.size() > 2) {
            reduce(operators, operands, context);
        }

        Token top = operators.pop();
        if (top.type() == TokenType.LOWEST_PREC) {
            return wrap(first.pos(), operands.pop());
        }

        Token sentinel = operators.pop();
        if (sentinel.type() != TokenType.LOWEST_PREC) {
            throw parser.unexpected(sentinel, context);
        }
        return wrap(first.pos(), combine(top, operands, context));
    }

    private void reduce(Deque<Token> operators, Deque<Node> operands, String context) throws ParseException {
        operands.push(combine(operators.pop(), operands, context));
    }

    private Node combine(Token operator, Deque<Node> operands, String context) throws ParseException {
        if (operands.size() < 2) {
            throw parser.errorf("missing value for %s", context);
        }
        Node right = operands.pop();
        Node left = operands.pop();

        if (operator.type() == TokenType.DOT) {
            return chain(left, right);
        }

        ExpressionNode expression = tree.newExpression(left.position(), operator.type());
        expression.append(right);
        expression.append(left);
        return expression;
    }

    private ChainNode chain(Node left, Node right) throws ParseException {
        if (!(right instanceof IdentifierNode field)) {
            throw parser.errorf("bad field access: %s", right);
        }
        ChainNode chain = left instanceof ChainNode existing
            ? existing
            : tree.newChain(left.position(), left);
        chain.addField(field.name());
        return chain;
    }

    private ExpressionNode wrap(int pos, Node node) {
        if (node instanceof ExpressionNode expression) {
            return expression;
        }
        ExpressionNode expression = tree.newExpression(pos, TokenType.LOWEST_PREC);
        expression.append(node);
        return expression;
    }
}
