package com.ftlast.core.lexer;

import com.ftlast.core.util.Quoting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Character-level scanner turning template source text into a {@link Token} sequence.
 *
 * <p>The scanner is a state machine whose states are methods returning the next state.
 * It is pull-based: a state runs only when the consumer asks for a token and the
 * buffer is empty, so the scanner is never ahead of the consumer by more than the
 * tokens a single state emits. Tokens come out strictly in source order.
 *
 * <p>The sequence always ends with exactly one {@link TokenType#EOF} or one
 * {@link TokenType#ERROR} token. After that {@link #hasNext()} returns false.
 *
 * <p><b>Recognized markers in text:</b>
 * <ul>
 *   <li>{@code ${ ... }} - interpolation</li>
 *   <li>{@code <#-- ... -->} - comment, dropped entirely</li>
 *   <li>{@code <# ... >} - directive</li>
 *   <li>{@code </# ... >} - directive end</li>
 * </ul>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * Lexer lexer = new Lexer("greeting", "Hello ${user.name}!");
 * while (lexer.hasNext()) {
 *     Token token = lexer.next();
 *     System.out.println(token.type() + " " + token);
 * }
 * }</pre>
 *
 * <p>Instances are not thread-safe; one parse owns one lexer.
 */
public final class Lexer implements Iterator<Token> {

    private static final Logger log = LoggerFactory.getLogger(Lexer.class);

    private static final int EOF_RUNE = -1;

    private static final String LEFT_INTERPOLATION = "${";
    private static final String LEFT_COMMENT = "<#--";
    private static final String RIGHT_COMMENT = "-->";
    private static final String START_DIRECTIVE = "<#";
    private static final String END_DIRECTIVE = "</#";

    private static final String DECIMAL_DIGITS = "0123456789";
    private static final String HEX_DIGITS = "0123456789abcdefABCDEF";

    @FunctionalInterface
    private interface StateFn {
        StateFn run();
    }

    private final String name;
    private final String input;
    private final Deque<Token> pending = new ArrayDeque<>();

    private StateFn state;
    private int pos;
    private int start;
    private int width;
    private int line = 1;
    private int startLine = 1;
    private int parenDepth;
    private boolean inInterpolation;
    private TokenType lastSignificant;

    /**
     * Creates a scanner positioned at the start of {@code input}.
     *
     * @param name name of the input, used only in diagnostics
     * @param input template source text
     */
    public Lexer(String name, String input) {
        this.name = name;
        this.input = input;
        this.state = this::lexText;
    }

    /**
     * Scans {@code input} to completion and returns every token, including the final
     * {@link TokenType#EOF} or {@link TokenType#ERROR} token.
     *
     * @param name name of the input
     * @param input template source text
     * @return all tokens in source order
     */
    public static List<Token> tokenize(String name, String input) {
        Lexer lexer = new Lexer(name, input);
        List<Token> tokens = new ArrayList<>();
        lexer.forEachRemaining(tokens::add);
        return tokens;
    }

    public String name() {
        return name;
    }

    @Override
    public boolean hasNext() {
        fill();
        return !pending.isEmpty();
    }

    @Override
    public Token next() {
        fill();
        Token token = pending.poll();
        if (token == null) {
            throw new NoSuchElementException("token stream of " + name + " is exhausted");
        }
        return token;
    }

    /**
     * Abandons the remaining input: buffered tokens are discarded and the state
     * machine stops. Called by the parser on every error path.
     */
    public void drain() {
        int discarded = pending.size();
        pending.clear();
        boolean wasRunning = state != null;
        state = null;
        log.debug("Drained scanner for {} at offset {} ({} buffered tokens discarded, running={})",
            name, pos, discarded, wasRunning);
    }

    private void fill() {
        while (pending.isEmpty() && state != null) {
            state = state.run();
        }
    }

    // Character primitives.

    private int nextRune() {
        if (pos >= input.length()) {
            width = 0;
            return EOF_RUNE;
        }
        int r = input.codePointAt(pos);
        width = Character.charCount(r);
        pos += width;
        if (r == '\n') {
            line++;
        }
        return r;
    }

    private int peekRune() {
        int r = nextRune();
        backup();
        return r;
    }

    // Steps back one rune; valid once per call of nextRune.
    private void backup() {
        pos -= width;
        if (width == 1 && input.charAt(pos) == '\n') {
            line--;
        }
        width = 0;
    }

    private void advanceTo(int target) {
        for (int i = pos; i < target; i++) {
            if (input.charAt(i) == '\n') {
                line++;
            }
        }
        pos = target;
    }

    private void emit(TokenType type) {
        pending.add(new Token(type, start, input.substring(start, pos), startLine));
        if (type != TokenType.SPACE) {
            lastSignificant = type;
        }
        ignore();
    }

    private void ignore() {
        start = pos;
        startLine = line;
    }

    private boolean accept(String valid) {
        int r = nextRune();
        if (r != EOF_RUNE && valid.indexOf(r) >= 0) {
            return true;
        }
        backup();
        return false;
    }

    private void acceptRun(String valid) {
        int r;
        do {
            r = nextRune();
        } while (r != EOF_RUNE && valid.indexOf(r) >= 0);
        backup();
    }

    // Emits an error token and stops the machine.
    private StateFn errorf(String format, Object... args) {
        pending.add(new Token(TokenType.ERROR, start, String.format(format, args), line));
        return null;
    }

    // States.

    private StateFn lexText() {
        width = 0;

        int interpolation = input.indexOf(LEFT_INTERPOLATION, pos);
        int comment = input.indexOf(LEFT_COMMENT, pos);
        int directive = input.indexOf(START_DIRECTIVE, pos);
        int end = input.indexOf(END_DIRECTIVE, pos);

        int nearest = nearest(nearest(interpolation, comment), nearest(directive, end));
        if (nearest < 0) {
            advanceTo(input.length());
            if (pos > start) {
                emit(TokenType.TEXT);
            }
            emit(TokenType.EOF);
            return null;
        }

        advanceTo(nearest);
        if (pos > start) {
            emit(TokenType.TEXT);
        }

        if (nearest == interpolation) {
            return this::lexInterpolation;
        }
        if (nearest == comment) {
            return this::lexComment;
        }
        return this::lexDirective;
    }

    private static int nearest(int a, int b) {
        if (a < 0) {
            return b;
        }
        if (b < 0) {
            return a;
        }
        return Math.min(a, b);
    }

    private StateFn lexInterpolation() {
        advanceTo(pos + LEFT_INTERPOLATION.length());
        emit(TokenType.LEFT_INTERPOLATION);
        inInterpolation = true;
        parenDepth = 0;
        return this::lexExpression;
    }

    private StateFn lexComment() {
        advanceTo(pos + LEFT_COMMENT.length());
        int close = input.indexOf(RIGHT_COMMENT, pos);
        if (close < 0) {
            return errorf("unclosed comment");
        }
        advanceTo(close + RIGHT_COMMENT.length());
        ignore();
        return this::lexText;
    }

    private StateFn lexDirective() {
        if (input.startsWith(END_DIRECTIVE, pos)) {
            advanceTo(pos + END_DIRECTIVE.length());
            emit(TokenType.END_DIRECTIVE);
        } else {
            advanceTo(pos + START_DIRECTIVE.length());
            emit(TokenType.START_DIRECTIVE);
        }
        inInterpolation = false;
        parenDepth = 0;
        return this::lexExpression;
    }

    // Scans the inside of an interpolation or a directive.
    private StateFn lexExpression() {
        int r = nextRune();

        if (r == EOF_RUNE) {
            return errorf(inInterpolation ? "unclosed interpolation" : "unclosed directive");
        }
        if (isSpace(r) || isEndOfLine(r)) {
            return this::lexSpace;
        }
        if (r == '.') {
            // ".5" is a number, anything else is a field access
            if (!isDigit(peekRune())) {
                emit(TokenType.DOT);
                return this::lexExpression;
            }
            backup();
            return this::lexNumber;
        }
        if (isDigit(r)) {
            backup();
            return this::lexNumber;
        }
        if (r == '+' || r == '-') {
            int following = peekRune();
            if (atOperandPosition() && (isDigit(following) || following == '.')) {
                backup();
                return this::lexNumber;
            }
            emit(r == '+' ? TokenType.ADD : TokenType.MINUS);
            return this::lexExpression;
        }
        if (r == '*') {
            emit(TokenType.MULTIPLY);
            return this::lexExpression;
        }
        if (r == '/') {
            emit(TokenType.DIVIDE);
            return this::lexExpression;
        }
        if (r == '"') {
            return this::lexString;
        }
        if (r == '\'') {
            return this::lexChar;
        }
        if (r == '!' || r == '=' || r == '<') {
            backup();
            return this::lexComparator;
        }
        if (isAlphaNumeric(r)) {
            backup();
            return this::lexIdentifier;
        }
        if (r == '(') {
            emit(TokenType.LEFT_PAREN);
            parenDepth++;
            return this::lexExpression;
        }
        if (r == ')') {
            if (parenDepth == 0) {
                return errorf("unexpected right paren %s", Quoting.describeCodePoint(r));
            }
            parenDepth--;
            emit(TokenType.RIGHT_PAREN);
            return this::lexExpression;
        }
        if (r == '>' || r == '}') {
            if (parenDepth > 0) {
                return errorf("unclosed left paren");
            }
            emit(r == '>' ? TokenType.CLOSE_DIRECTIVE : TokenType.RIGHT_INTERPOLATION);
            return this::lexText;
        }
        return errorf("unrecognized character in action: %s", Quoting.describeCodePoint(r));
    }

    // One blank has already been seen.
    private StateFn lexSpace() {
        int r = peekRune();
        while (isSpace(r) || isEndOfLine(r)) {
            nextRune();
            r = peekRune();
        }
        emit(TokenType.SPACE);
        return this::lexExpression;
    }

    private StateFn lexIdentifier() {
        int r;
        do {
            r = nextRune();
        } while (isAlphaNumeric(r));
        backup();

        String word = input.substring(start, pos);
        if (!atTerminator()) {
            return errorf("bad character %s", Quoting.describeCodePoint(peekRune()));
        }

        TokenType type = TokenType.directive(word)
            .or(() -> TokenType.comparator(word))
            .orElse(word.equals("true") || word.equals("false") ? TokenType.BOOL : TokenType.IDENTIFIER);
        emit(type);
        return this::lexExpression;
    }

    private StateFn lexComparator() {
        int comparator = nextRune();
        int r = peekRune();

        if (comparator == '<') {
            if (r == '=') {
                nextRune();
                emit(TokenType.LESS_EQ);
            } else {
                emit(TokenType.LESS);
            }
            return this::lexExpression;
        }

        if (r != '=') {
            return errorf("unexpected comparator %s", Quoting.describeCodePoint(comparator));
        }
        nextRune();
        emit(comparator == '=' ? TokenType.EQ : TokenType.NEQ);
        return this::lexExpression;
    }

    private StateFn lexChar() {
        if (!scanQuoted('\'')) {
            return errorf("unterminated character constant");
        }
        emit(TokenType.CHAR_CONSTANT);
        return this::lexExpression;
    }

    private StateFn lexString() {
        if (!scanQuoted('"')) {
            return errorf("unterminated quoted string");
        }
        emit(TokenType.STRING_CONSTANT);
        return this::lexExpression;
    }

    // The opening quote has been consumed.
    private boolean scanQuoted(char quote) {
        while (true) {
            int r = nextRune();
            if (r == '\\') {
                r = nextRune();
                if (r != EOF_RUNE && r != '\n') {
                    continue;
                }
            }
            if (r == EOF_RUNE || r == '\n') {
                return false;
            }
            if (r == quote) {
                return true;
            }
        }
    }

    // Accepts more than valid numbers ("089", "0x0.2"); the classifier rejects the rest.
    private StateFn lexNumber() {
        if (!scanNumber()) {
            return errorf("bad number syntax: %s", Quoting.quote(input.substring(start, pos)));
        }

        int sign = peekRune();
        if (sign == '+' || sign == '-') {
            // complex literal: 1+2i, no blanks, must end in 'i'
            int realEnd = pos;
            if (scanNumber() && pos > realEnd + 1 && input.charAt(pos - 1) == 'i') {
                emit(TokenType.NUMBER);
                return this::lexExpression;
            }
            pos = realEnd;
            width = 0;
        }

        emit(TokenType.NUMBER);
        return this::lexExpression;
    }

    private boolean scanNumber() {
        accept("+-");
        String digits = DECIMAL_DIGITS;
        if (accept("0") && accept("xX")) {
            digits = HEX_DIGITS;
        }
        acceptRun(digits);
        if (accept(".")) {
            acceptRun(digits);
        }
        if (accept("eE")) {
            accept("+-");
            acceptRun(DECIMAL_DIGITS);
        }
        accept("i");
        if (isAlphaNumeric(peekRune())) {
            nextRune();
            return false;
        }
        return true;
    }

    // Signs start a number only where an operand is expected.
    private boolean atOperandPosition() {
        if (lastSignificant == null) {
            return true;
        }
        return switch (lastSignificant) {
            case IDENTIFIER, NUMBER, BOOL, STRING_CONSTANT, CHAR_CONSTANT, RIGHT_PAREN -> false;
            default -> true;
        };
    }

    // Reports whether the next rune may legally follow an identifier.
    private boolean atTerminator() {
        int r = peekRune();
        if (r == EOF_RUNE || isSpace(r) || isEndOfLine(r)) {
            return true;
        }
        return switch (r) {
            case '.', ',', '|', ':', ')', '(', '>', '}', '+', '-', '*', '/', '=', '!', '<' -> true;
            default -> false;
        };
    }

    private static boolean isSpace(int r) {
        return r == ' ' || r == '\t';
    }

    private static boolean isEndOfLine(int r) {
        return r == '\r' || r == '\n';
    }

    private static boolean isDigit(int r) {
        return r >= '0' && r <= '9';
    }

    private static boolean isAlphaNumeric(int r) {
        return r == '_' || (r >= 0 && (Character.isLetter(r) || Character.isDigit(r)));
    }
}
