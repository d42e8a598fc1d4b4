package com.ftlast.core.lexer;

import java.util.Map;
import java.util.Optional;

/**
 * Kinds of tokens produced by the {@link Lexer}.
 *
 * <p>Each kind belongs to a {@link Category}. Classification (is this an operator? a
 * directive keyword?) always goes through the category, never through the declaration
 * order of the constants.
 *
 * <p>Operators carry a binding precedence used by the expression parser:
 * <ul>
 *   <li>{@code .} (field chain) - 6</li>
 *   <li>{@code * /} - 5</li>
 *   <li>{@code + -} - 4</li>
 *   <li>{@code < <= gt gte == !=} - 3</li>
 *   <li>the sentinel {@link #LOWEST_PREC} - 0</li>
 * </ul>
 */
public enum TokenType {

    ERROR("error", Category.SPECIAL),
    EOF("EOF", Category.SPECIAL),
    BOOL("bool", Category.LITERAL),
    IDENTIFIER("identifier", Category.LITERAL),
    TEXT("text", Category.SPECIAL),
    NUMBER("number", Category.LITERAL),
    CHAR_CONSTANT("char", Category.LITERAL),
    STRING_CONSTANT("string", Category.LITERAL),
    SPACE("space", Category.SPECIAL),

    ADD("+", Category.OPERATOR, 4),
    MINUS("-", Category.OPERATOR, 4),
    MULTIPLY("*", Category.OPERATOR, 5),
    DIVIDE("/", Category.OPERATOR, 5),
    LESS("<", Category.OPERATOR, 3),
    LESS_EQ("<=", Category.OPERATOR, 3),
    GREATER("gt", Category.OPERATOR, 3),
    GREATER_EQ("gte", Category.OPERATOR, 3),
    EQ("==", Category.OPERATOR, 3),
    NEQ("!=", Category.OPERATOR, 3),
    DOT(".", Category.OPERATOR, 6),
    /** Synthetic bottom-of-stack operator bounding one expression. Never produced by the lexer. */
    LOWEST_PREC("#", Category.OPERATOR, 0),

    LEFT_INTERPOLATION("${", Category.DELIMITER),
    RIGHT_INTERPOLATION("}", Category.DELIMITER),
    START_DIRECTIVE("<#", Category.DELIMITER),
    CLOSE_DIRECTIVE(">", Category.DELIMITER),
    END_DIRECTIVE("</#", Category.DELIMITER),
    LEFT_PAREN("(", Category.DELIMITER),
    RIGHT_PAREN(")", Category.DELIMITER),

    INCLUDE("include", Category.DIRECTIVE),
    MACRO("macro", Category.DIRECTIVE),
    IF("if", Category.DIRECTIVE),
    ELSEIF("elseif", Category.DIRECTIVE),
    ELSE("else", Category.DIRECTIVE),
    LIST("list", Category.DIRECTIVE),
    AS("as", Category.DIRECTIVE);

    /** Precedence of non-operators and of the sentinel. */
    public static final int LOWEST_PRECEDENCE = 0;

    /** Precedence of the tightest-binding operator. */
    public static final int HIGHEST_PRECEDENCE = 6;

    /**
     * Broad classification of token kinds.
     */
    public enum Category {
        /** Errors, end of input, raw text, blanks */
        SPECIAL,
        /** Operands: booleans, identifiers, numbers, characters, strings */
        LITERAL,
        /** Binary operators */
        OPERATOR,
        /** Interpolation, directive and parenthesis delimiters */
        DELIMITER,
        /** Directive keywords */
        DIRECTIVE
    }

    private static final Map<String, TokenType> DIRECTIVES = Map.of(
        "include", INCLUDE,
        "macro", MACRO,
        "if", IF,
        "elseif", ELSEIF,
        "else", ELSE,
        "list", LIST,
        "as", AS
    );

    private static final Map<String, TokenType> COMPARATORS = Map.of(
        "gt", GREATER,
        "gte", GREATER_EQ
    );

    private final String display;
    private final Category category;
    private final int precedence;

    TokenType(String display, Category category) {
        this(display, category, LOWEST_PRECEDENCE);
    }

    TokenType(String display, Category category, int precedence) {
        this.display = display;
        this.category = category;
        this.precedence = precedence;
    }

    /**
     * Returns the directive keyword spelled by {@code word}, if any.
     *
     * @param word alphanumeric run
     * @return keyword kind
     */
    public static Optional<TokenType> directive(String word) {
        return Optional.ofNullable(DIRECTIVES.get(word));
    }

    /**
     * Returns the keyword comparator ({@code gt}, {@code gte}) spelled by {@code word}, if any.
     *
     * @param word alphanumeric run
     * @return comparator kind
     */
    public static Optional<TokenType> comparator(String word) {
        return Optional.ofNullable(COMPARATORS.get(word));
    }

    public Category category() {
        return category;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isOperator() {
        return category == Category.OPERATOR;
    }

    public boolean isDirective() {
        return category == Category.DIRECTIVE;
    }

    public boolean isDelimiter() {
        return category == Category.DELIMITER;
    }

    public boolean isLiteral() {
        return category == Category.LITERAL;
    }

    /**
     * Surface spelling for operators and delimiters, a short name for everything else.
     */
    @Override
    public String toString() {
        return display;
    }
}
