package com.ftlast.core.util;

/**
 * Quoting and unquoting of template literals.
 *
 * <p>String and character literals inside expressions use C-style backslash escapes:
 * {@code \a \b \f \n \r \t \v \\ \' \"}, octal {@code \ooo}, hexadecimal
 * {@code \xHH} and the four- and eight-digit unicode escapes. The same escapes are produced by
 * {@link #quote(String)} for diagnostic output.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * String name = Quoting.unquote("\"header.ftl\"");   // header.ftl
 * String shown = Quoting.quote("a\tb");              // "a\tb"
 * }</pre>
 */
public final class Quoting {

    private Quoting() {
        // Utility class - no instantiation
    }

    /**
     * A code point decoded from an escaped literal.
     *
     * @param codePoint decoded code point
     * @param next index of the first character after the decoded sequence
     */
    public record DecodedChar(int codePoint, int next) {}

    /**
     * Quotes a string with double quotes, escaping control and non-printable characters.
     *
     * @param s string to quote
     * @return quoted representation
     */
    public static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        int i = 0;
        while (i < s.length()) {
            int cp = s.codePointAt(i);
            i += Character.charCount(cp);
            appendEscaped(sb, cp);
        }
        sb.append('"');
        return sb.toString();
    }

    /**
     * Removes the quotes of a string literal and decodes its escapes.
     *
     * <p>Double-quoted literals may hold any number of characters; single-quoted
     * literals must hold exactly one.
     *
     * @param literal quoted literal, including its quotes
     * @return decoded value
     * @throws IllegalArgumentException if the literal is malformed
     */
    public static String unquote(String literal) {
        int n = literal.length();
        if (n < 2) {
            throw new IllegalArgumentException("invalid syntax: " + literal);
        }
        char quote = literal.charAt(0);
        if (quote != literal.charAt(n - 1) || (quote != '"' && quote != '\'')) {
            throw new IllegalArgumentException("invalid syntax: " + literal);
        }

        String body = literal.substring(1, n - 1);
        if (body.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("invalid syntax: " + literal);
        }

        StringBuilder sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            DecodedChar decoded = decodeChar(body, i, quote);
            sb.appendCodePoint(decoded.codePoint());
            i = decoded.next();
        }

        if (quote == '\'' && sb.codePointCount(0, sb.length()) != 1) {
            throw new IllegalArgumentException("invalid syntax: " + literal);
        }
        return sb.toString();
    }

    /**
     * Decodes one possibly escaped character of a literal body.
     *
     * @param s literal text
     * @param start index of the character (or backslash) to decode
     * @param quote quote character of the enclosing literal; an unescaped occurrence is rejected
     * @return decoded code point and the index following it
     * @throws IllegalArgumentException if the escape sequence is malformed
     */
    public static DecodedChar decodeChar(String s, int start, char quote) {
        if (start >= s.length()) {
            throw new IllegalArgumentException("invalid syntax: unexpected end of literal");
        }
        int c = s.codePointAt(start);
        if (c == quote) {
            throw new IllegalArgumentException("invalid syntax: unescaped quote");
        }
        if (c != '\\') {
            return new DecodedChar(c, start + Character.charCount(c));
        }

        if (start + 1 >= s.length()) {
            throw new IllegalArgumentException("invalid syntax: dangling backslash");
        }
        char e = s.charAt(start + 1);
        int i = start + 2;
        return switch (e) {
            case 'a' -> new DecodedChar(0x07, i);
            case 'b' -> new DecodedChar('\b', i);
            case 'f' -> new DecodedChar('\f', i);
            case 'n' -> new DecodedChar('\n', i);
            case 'r' -> new DecodedChar('\r', i);
            case 't' -> new DecodedChar('\t', i);
            case 'v' -> new DecodedChar(0x0B, i);
            case '\\' -> new DecodedChar('\\', i);
            case 'x' -> new DecodedChar(parseDigits(s, i, 2, 16), i + 2);
            case 'u' -> new DecodedChar(checkCodePoint(parseDigits(s, i, 4, 16)), i + 4);
            case 'U' -> new DecodedChar(checkCodePoint(parseDigits(s, i, 8, 16)), i + 8);
            case '\'', '"' -> {
                if (e != quote) {
                    throw new IllegalArgumentException("invalid syntax: bad escape \\" + e);
                }
                yield new DecodedChar(e, i);
            }
            default -> {
                if (e < '0' || e > '7') {
                    throw new IllegalArgumentException("invalid syntax: bad escape \\" + e);
                }
                int v = parseDigits(s, start + 1, 3, 8);
                if (v > 255) {
                    throw new IllegalArgumentException("invalid syntax: octal escape out of range");
                }
                yield new DecodedChar(v, start + 4);
            }
        };
    }

    /**
     * Formats a code point the way diagnostics show offending characters, e.g. {@code U+0040 '@'}.
     *
     * @param codePoint code point, or -1 for end of input
     * @return printable description
     */
    public static String describeCodePoint(int codePoint) {
        if (codePoint < 0) {
            return "EOF";
        }
        String hex = String.format("U+%04X", codePoint);
        if (isPrintable(codePoint)) {
            return hex + " '" + new String(Character.toChars(codePoint)) + "'";
        }
        return hex;
    }

    private static int parseDigits(String s, int from, int count, int radix) {
        if (from + count > s.length()) {
            throw new IllegalArgumentException("invalid syntax: truncated escape");
        }
        int v = 0;
        for (int k = from; k < from + count; k++) {
            int d = Character.digit(s.charAt(k), radix);
            if (d < 0) {
                throw new IllegalArgumentException("invalid syntax: bad digit in escape");
            }
            v = v * radix + d;
        }
        return v;
    }

    private static int checkCodePoint(int v) {
        if (!Character.isValidCodePoint(v) || (v >= 0xD800 && v <= 0xDFFF)) {
            throw new IllegalArgumentException("invalid syntax: escape is not a valid code point");
        }
        return v;
    }

    private static void appendEscaped(StringBuilder sb, int cp) {
        switch (cp) {
            case 0x07 -> sb.append("\\a");
            case '\b' -> sb.append("\\b");
            case '\f' -> sb.append("\\f");
            case '\n' -> sb.append("\\n");
            case '\r' -> sb.append("\\r");
            case '\t' -> sb.append("\\t");
            case 0x0B -> sb.append("\\v");
            case '\\' -> sb.append("\\\\");
            case '"' -> sb.append("\\\"");
            default -> {
                if (isPrintable(cp)) {
                    sb.appendCodePoint(cp);
                } else if (cp < 0x80) {
                    sb.append(String.format("\\x%02x", cp));
                } else if (cp <= 0xFFFF) {
                    sb.append(String.format("\\u%04x", cp));
                } else {
                    sb.append(String.format("\\U%08x", cp));
                }
            }
        }
    }

    private static boolean isPrintable(int cp) {
        if (cp == ' ') {
            return true;
        }
        if (Character.isSpaceChar(cp) || Character.isISOControl(cp)) {
            return false;
        }
        int type = Character.getType(cp);
        return type != Character.UNASSIGNED
            && type != Character.FORMAT
            && type != Character.SURROGATE
            && type != Character.PRIVATE_USE;
    }
}
