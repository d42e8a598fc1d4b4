package com.ftlast.core.lexer;

import com.ftlast.core.util.Quoting;

import java.util.Objects;

/**
 * A lexical unit emitted by the {@link Lexer}.
 *
 * @param type kind of token
 * @param pos offset of the first character of the lexeme in the source text
 * @param value lexeme text; for {@link TokenType#ERROR} tokens the error message
 * @param line 1-based line number at the start of the token
 */
public record Token(TokenType type, int pos, String value, int line) {

    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    /**
     * Diagnostic form used in parser error messages.
     */
    @Override
    public String toString() {
        if (type == TokenType.EOF) {
            return "EOF";
        }
        if (type == TokenType.ERROR) {
            return value;
        }
        if (type.isDirective()) {
            return "<" + value + ">";
        }
        if (type.isOperator()) {
            return "[" + value + "]";
        }
        if (value.length() > 10) {
            return Quoting.quote(value.substring(0, 10)) + "...";
        }
        return Quoting.quote(value);
    }
}
