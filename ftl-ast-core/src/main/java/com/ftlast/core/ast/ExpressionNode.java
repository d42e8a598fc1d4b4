package com.ftlast.core.ast;

import com.ftlast.core.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An operator applied to its operands, or a single operand wrapped as an expression.
 *
 * <p>Binary expressions hold their operands in the order the expression parser
 * popped them off its operand stack: right operand first. {@code a == b} therefore
 * renders as {@code b==a}. Operands that are themselves expressions render
 * parenthesized.
 *
 * <p>Interpolations ({@code ${...}}) and directive conditions are represented
 * directly by an expression node.
 */
public final class ExpressionNode extends AbstractNode {

    private final TokenType operator;
    private final List<Node> operands = new ArrayList<>();

    /**
     * Creates an empty expression.
     *
     * @param position source offset
     * @param source source reference
     * @param operator binary operator, or {@link TokenType#LOWEST_PREC} for a single operand
     */
    public ExpressionNode(int position, TemplateSource source, TokenType operator) {
        super(NodeType.EXPRESSION, position, source);
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
    }

    public void append(Node operand) {
        operands.add(operand);
    }

    public TokenType operator() {
        return operator;
    }

    public List<Node> operands() {
        return Collections.unmodifiableList(operands);
    }

    /**
     * Checks if this expression only wraps one operand.
     *
     * @return true if no operator is applied
     */
    public boolean isSingle() {
        return operator == TokenType.LOWEST_PREC;
    }

    @Override
    public String render(TextFormat format) {
        String symbol = operator.toString();
        if (Character.isLetter(symbol.charAt(0))) {
            symbol = " " + symbol + " ";
        }

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) {
                sb.append(symbol);
            }
            Node operand = operands.get(i);
            if (operand instanceof ExpressionNode) {
                sb.append('(').append(operand.render(format)).append(')');
            } else {
                sb.append(operand.render(format));
            }
        }
        return sb.toString();
    }

    @Override
    public ExpressionNode copy() {
        ExpressionNode copy = new ExpressionNode(position(), source(), operator);
        for (Node operand : operands) {
            copy.append(operand.copy());
        }
        return copy;
    }
}
