package com.ftlast.core.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

import static com.ftlast.core.lexer.TokenType.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Lexer}.
 */
class LexerTest {

    private static List<TokenType> types(String input) {
        return Lexer.tokenize("test", input).stream().map(Token::type).toList();
    }

    private static Token last(String input) {
        List<Token> tokens = Lexer.tokenize("test", input);
        return tokens.get(tokens.size() - 1);
    }

    @Test
    void tokenize_interpolatedIdentifier_yieldsDelimitersAroundIdentifier() {
        List<Token> tokens = Lexer.tokenize("test", "${abc}");

        assertThat(tokens).extracting(Token::type)
            .containsExactly(LEFT_INTERPOLATION, IDENTIFIER, RIGHT_INTERPOLATION, EOF);
        assertThat(tokens.get(1).value()).isEqualTo("abc");
        assertThat(tokens.get(1).pos()).isEqualTo(2);
    }

    @Test
    void tokenize_interpolatedFloat_yieldsNumber() {
        List<Token> tokens = Lexer.tokenize("test", "${1.5}");

        assertThat(tokens).extracting(Token::type)
            .containsExactly(LEFT_INTERPOLATION, NUMBER, RIGHT_INTERPOLATION, EOF);
        assertThat(tokens.get(1).value()).isEqualTo("1.5");
    }

    @Test
    void tokenize_plainText_yieldsSingleTextToken() {
        List<Token> tokens = Lexer.tokenize("test", "just some text\n");

        assertThat(tokens).extracting(Token::type).containsExactly(TEXT, EOF);
        assertThat(tokens.get(0).value()).isEqualTo("just some text\n");
    }

    @Test
    void tokenize_emptyInput_yieldsOnlyEof() {
        assertThat(types("")).containsExactly(EOF);
    }

    @Test
    void tokenize_unterminatedComment_yieldsTextThenErrorOnly() {
        List<Token> tokens = Lexer.tokenize("test", "hello<#--world");

        assertThat(tokens).extracting(Token::type).containsExactly(TEXT, ERROR);
        assertThat(tokens.get(0).value()).isEqualTo("hello");
        assertThat(tokens.get(1).value()).isEqualTo("unclosed comment");
    }

    @Test
    void tokenize_comment_isDroppedAndLinesStillCounted() {
        List<Token> tokens = Lexer.tokenize("test", "hello-<#--\n\n\n-->-world");

        assertThat(tokens).extracting(Token::type).containsExactly(TEXT, TEXT, EOF);
        assertThat(tokens.get(1).value()).isEqualTo("-world");
        assertThat(tokens.get(1).line()).isEqualTo(4);
    }

    @Test
    void tokenize_ifDirective_yieldsKeywordsSpacesAndComparator() {
        assertThat(types("<#if a == b>x</#if>")).containsExactly(
            START_DIRECTIVE, IF, SPACE, IDENTIFIER, SPACE, EQ, SPACE, IDENTIFIER, CLOSE_DIRECTIVE,
            TEXT,
            END_DIRECTIVE, IF, CLOSE_DIRECTIVE,
            EOF);
    }

    @Test
    void tokenize_markersInAnyOrder_takesNearestFirst() {
        assertThat(types("x<#if a>${b}</#if>")).containsExactly(
            TEXT,
            START_DIRECTIVE, IF, SPACE, IDENTIFIER, CLOSE_DIRECTIVE,
            LEFT_INTERPOLATION, IDENTIFIER, RIGHT_INTERPOLATION,
            END_DIRECTIVE, IF, CLOSE_DIRECTIVE,
            EOF);
    }

    @Test
    void tokenize_listDirective_recognizesAsKeyword() {
        assertThat(types("<#list items as item>")).containsExactly(
            START_DIRECTIVE, LIST, SPACE, IDENTIFIER, SPACE, AS, SPACE, IDENTIFIER, CLOSE_DIRECTIVE, EOF);
    }

    @Test
    void tokenize_blankRun_yieldsOneSpaceToken() {
        List<Token> tokens = Lexer.tokenize("test", "${ \t\r\n a}");

        assertThat(tokens).extracting(Token::type)
            .containsExactly(LEFT_INTERPOLATION, SPACE, IDENTIFIER, RIGHT_INTERPOLATION, EOF);
        assertThat(tokens.get(1).value()).isEqualTo(" \t\r\n ");
    }

    static Stream<Arguments> expressionTokens() {
        return Stream.of(
            Arguments.of("${a.b}", List.of(IDENTIFIER, DOT, IDENTIFIER)),
            Arguments.of("${.5}", List.of(NUMBER)),
            Arguments.of("${-1}", List.of(NUMBER)),
            Arguments.of("${a-1}", List.of(IDENTIFIER, MINUS, NUMBER)),
            Arguments.of("${a - -1}", List.of(IDENTIFIER, SPACE, MINUS, SPACE, NUMBER)),
            Arguments.of("${(1)-2}", List.of(LEFT_PAREN, NUMBER, RIGHT_PAREN, MINUS, NUMBER)),
            Arguments.of("${a*b/c}", List.of(IDENTIFIER, MULTIPLY, IDENTIFIER, DIVIDE, IDENTIFIER)),
            Arguments.of("${a+b}", List.of(IDENTIFIER, ADD, IDENTIFIER)),
            Arguments.of("${1+2}", List.of(NUMBER, ADD, NUMBER)),
            Arguments.of("${1+2i}", List.of(NUMBER)),
            Arguments.of("${0x1F}", List.of(NUMBER)),
            Arguments.of("${1e-3}", List.of(NUMBER)),
            Arguments.of("${a<b}", List.of(IDENTIFIER, LESS, IDENTIFIER)),
            Arguments.of("${a<=b}", List.of(IDENTIFIER, LESS_EQ, IDENTIFIER)),
            Arguments.of("${a!=b}", List.of(IDENTIFIER, NEQ, IDENTIFIER)),
            Arguments.of("${a gt b}", List.of(IDENTIFIER, SPACE, GREATER, SPACE, IDENTIFIER)),
            Arguments.of("${a gte b}", List.of(IDENTIFIER, SPACE, GREATER_EQ, SPACE, IDENTIFIER)),
            Arguments.of("${true}", List.of(BOOL)),
            Arguments.of("${\"a\\\"b\"}", List.of(STRING_CONSTANT)),
            Arguments.of("${'x'}", List.of(CHAR_CONSTANT)),
            Arguments.of("${'\\n'}", List.of(CHAR_CONSTANT))
        );
    }

    @ParameterizedTest
    @MethodSource("expressionTokens")
    void tokenize_expression_yieldsExpectedKinds(String input, List<TokenType> expected) {
        List<TokenType> actual = types(input);

        assertThat(actual.subList(1, actual.size() - 2)).isEqualTo(expected);
        assertThat(actual.get(actual.size() - 2)).isEqualTo(RIGHT_INTERPOLATION);
        assertThat(actual.get(actual.size() - 1)).isEqualTo(EOF);
    }

    @Test
    void tokenize_complexLiteral_keepsWholeLexeme() {
        List<Token> tokens = Lexer.tokenize("test", "${1+2i}");

        assertThat(tokens.get(1).value()).isEqualTo("1+2i");
    }

    static Stream<Arguments> scanErrors() {
        return Stream.of(
            Arguments.of("${\"abc", "unterminated quoted string"),
            Arguments.of("${\"ab\ncd\"}", "unterminated quoted string"),
            Arguments.of("${'a", "unterminated character constant"),
            Arguments.of("${a = b}", "unexpected comparator U+003D '='"),
            Arguments.of("${a!}", "unexpected comparator U+0021 '!'"),
            Arguments.of("${a@}", "bad character U+0040 '@'"),
            Arguments.of("${@}", "unrecognized character in action: U+0040 '@'"),
            Arguments.of("${a)}", "unexpected right paren U+0029 ')'"),
            Arguments.of("${(a}", "unclosed left paren"),
            Arguments.of("<#if (a>", "unclosed left paren"),
            Arguments.of("<#if a", "unclosed directive"),
            Arguments.of("${a", "unclosed interpolation"),
            Arguments.of("${1x}", "bad number syntax: \"1x\"")
        );
    }

    @ParameterizedTest
    @MethodSource("scanErrors")
    void tokenize_malformedInput_endsWithErrorToken(String input, String message) {
        Token error = last(input);

        assertThat(error.type()).isEqualTo(ERROR);
        assertThat(error.value()).isEqualTo(message);
    }

    @Test
    void tokenize_errorToken_isNeverFollowedByEof() {
        List<Token> tokens = Lexer.tokenize("test", "text ${a@} more ${b}");

        assertThat(tokens).extracting(Token::type).containsOnlyOnce(ERROR).doesNotContain(EOF);
        assertThat(tokens.get(tokens.size() - 1).type()).isEqualTo(ERROR);
    }

    @Test
    void tokenize_multilineInput_recordsStartLineOfEachToken() {
        List<Token> tokens = Lexer.tokenize("test", "a\nb${\nc}");

        assertThat(tokens).extracting(Token::type)
            .containsExactly(TEXT, LEFT_INTERPOLATION, SPACE, IDENTIFIER, RIGHT_INTERPOLATION, EOF);
        assertThat(tokens).extracting(Token::line).containsExactly(1, 2, 2, 3, 3, 3);
    }

    @Test
    void next_afterEof_throwsNoSuchElement() {
        Lexer lexer = new Lexer("test", "x");
        assertThat(lexer.next().type()).isEqualTo(TEXT);
        assertThat(lexer.next().type()).isEqualTo(EOF);

        assertThat(lexer.hasNext()).isFalse();
        assertThatThrownBy(lexer::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void drain_midStream_stopsTheScanner() {
        Lexer lexer = new Lexer("test", "a${b}c${d}");
        assertThat(lexer.next().type()).isEqualTo(TEXT);

        lexer.drain();

        assertThat(lexer.hasNext()).isFalse();
    }

    @Test
    void hasNext_isIdempotent() {
        Lexer lexer = new Lexer("test", "${a}");

        assertThat(lexer.hasNext()).isTrue();
        assertThat(lexer.hasNext()).isTrue();
        assertThat(lexer.next().type()).isEqualTo(LEFT_INTERPOLATION);
        assertThat(lexer.name()).isEqualTo("test");
    }
}
