package com.ftlast.core.ast;

import com.ftlast.core.lexer.TokenType;
import com.ftlast.core.util.Quoting;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Numeric constant: a number literal or a character constant.
 *
 * <p>The literal is classified once, when the node is created, and its value is
 * stored under every representation that can hold it exactly. {@code 42} is a signed
 * int, an unsigned int and a float at the same time; {@code -1} is no unsigned int;
 * {@code 1.5} is only a float; {@code 2i} is only complex.
 *
 * <p><b>Classification Rules:</b>
 * <ol>
 *   <li>Character constant: the decoded code point is an int, an unsigned int and a float.</li>
 *   <li>Text ending in {@code i}: complex, simplified to the other representations when
 *       the imaginary part is zero.</li>
 *   <li>Unsigned parse, then signed parse, both accepting {@code 0x}, {@code 0o},
 *       {@code 0b} and leading-{@code 0} octal prefixes. Either success also sets the float.</li>
 *   <li>Only when neither integer parse matched: float parse. A float without
 *       {@code .}, {@code e} or {@code E} is an integer too large for 64 bits and is rejected.</li>
 * </ol>
 *
 * <p>Unsigned values are held in a {@code long} and must be read with the unsigned
 * helpers of {@link Long}, e.g. {@link Long#toUnsignedString(long)}.
 */
public final class NumberNode extends AbstractNode {

    private static final Pattern DECIMAL_FLOAT =
        Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final BigInteger MAX_UINT64 = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);
    private static final BigInteger MIN_INT64 = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger MAX_INT64 = BigInteger.valueOf(Long.MAX_VALUE);
    private static final double TWO_POW_63 = 0x1p63;
    private static final double TWO_POW_64 = 0x1p64;

    private final String text;
    private boolean isInt;
    private boolean isUint;
    private boolean isFloat;
    private boolean isComplex;
    private long intValue;
    private long uintValue;
    private double floatValue;
    private double realPart;
    private double imaginaryPart;

    private NumberNode(int position, TemplateSource source, String text) {
        super(NodeType.NUMBER, position, source);
        this.text = Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Classifies a literal and creates its node.
     *
     * @param position source offset
     * @param source source reference
     * @param text literal as written
     * @param type {@link TokenType#CHAR_CONSTANT} or {@link TokenType#NUMBER}
     * @return classified number
     * @throws NumberFormatException if the literal has no valid representation
     */
    public static NumberNode parse(int position, TemplateSource source, String text, TokenType type) {
        NumberNode n = new NumberNode(position, source, text);
        if (type == TokenType.CHAR_CONSTANT) {
            n.classifyCharConstant();
        } else if (!n.classifyImaginary()) {
            n.classifyNumber();
        }
        return n;
    }

    private void classifyCharConstant() {
        if (text.length() < 3 || text.charAt(0) != '\'') {
            throw new NumberFormatException("malformed character constant: " + text);
        }
        Quoting.DecodedChar decoded;
        try {
            decoded = Quoting.decodeChar(text, 1, '\'');
        } catch (IllegalArgumentException e) {
            throw new NumberFormatException(e.getMessage());
        }
        if (!text.substring(decoded.next()).equals("'")) {
            throw new NumberFormatException("malformed character constant: " + text);
        }
        int codePoint = decoded.codePoint();
        isInt = true;
        intValue = codePoint;
        isUint = true;
        uintValue = codePoint;
        isFloat = true;
        floatValue = codePoint;
    }

    // "2i" or "1+2i"; returns false when the text is not a valid imaginary literal
    private boolean classifyImaginary() {
        if (text.isEmpty() || text.charAt(text.length() - 1) != 'i') {
            return false;
        }
        String body = text.substring(0, text.length() - 1);
        int split = imaginarySplit(body);

        Double imaginary = parseFloat(body.substring(split));
        Double real = split == 0 ? Double.valueOf(0) : parseFloat(body.substring(0, split));
        if (imaginary == null || real == null) {
            return false;
        }
        isComplex = true;
        realPart = real;
        imaginaryPart = imaginary;
        simplifyComplex();
        return true;
    }

    // Index of the sign separating real and imaginary parts, or 0.
    private static int imaginarySplit(String body) {
        for (int i = body.length() - 1; i > 0; i--) {
            char c = body.charAt(i);
            if ((c == '+' || c == '-') && body.charAt(i - 1) != 'e' && body.charAt(i - 1) != 'E') {
                return i;
            }
        }
        return 0;
    }

    private void simplifyComplex() {
        isFloat = imaginaryPart == 0;
        if (isFloat) {
            floatValue = realPart;
            extractIntegers(realPart);
        }
    }

    private void classifyNumber() {
        BigInteger parsed = parseInteger(text);
        boolean signed = text.startsWith("+") || text.startsWith("-");

        if (parsed != null && !signed && parsed.signum() >= 0 && parsed.compareTo(MAX_UINT64) <= 0) {
            isUint = true;
            uintValue = parsed.longValue();
        }
        if (parsed != null && parsed.compareTo(MIN_INT64) >= 0 && parsed.compareTo(MAX_INT64) <= 0) {
            isInt = true;
            intValue = parsed.longValue();
            if (intValue == 0) {
                // -0
                isUint = true;
                uintValue = 0;
            }
        }

        if (isInt) {
            isFloat = true;
            floatValue = intValue;
        } else if (isUint) {
            isFloat = true;
            floatValue = parsed.doubleValue();
        } else {
            Double f = parseFloat(text);
            if (f != null) {
                if (!containsAny(text, ".eE")) {
                    throw new NumberFormatException("integer overflow: " + Quoting.quote(text));
                }
                isFloat = true;
                floatValue = f;
                extractIntegers(f);
            }
        }

        if (!isInt && !isUint && !isFloat) {
            throw new NumberFormatException("illegal number syntax: " + Quoting.quote(text));
        }
    }

    private void extractIntegers(double f) {
        if (f != Math.rint(f) || Double.isInfinite(f)) {
            return;
        }
        if (!isInt && f >= -TWO_POW_63 && f < TWO_POW_63) {
            isInt = true;
            intValue = (long) f;
        }
        if (!isUint && f >= 0 && f < TWO_POW_64) {
            isUint = true;
            uintValue = new BigDecimal(f).toBigInteger().longValue();
        }
    }

    // Integer syntax with base prefixes; null if the text is not an integer.
    private static BigInteger parseInteger(String s) {
        int i = 0;
        boolean negative = false;
        if (!s.isEmpty() && (s.charAt(0) == '+' || s.charAt(0) == '-')) {
            negative = s.charAt(0) == '-';
            i = 1;
        }
        String digits = s.substring(i);
        int radix = 10;
        if (digits.length() > 1 && digits.charAt(0) == '0') {
            char prefix = Character.toLowerCase(digits.charAt(1));
            if (prefix == 'x') {
                radix = 16;
                digits = digits.substring(2);
            } else if (prefix == 'o') {
                radix = 8;
                digits = digits.substring(2);
            } else if (prefix == 'b') {
                radix = 2;
                digits = digits.substring(2);
            } else {
                radix = 8;
                digits = digits.substring(1);
            }
        }
        if (digits.isEmpty()) {
            return null;
        }
        for (int k = 0; k < digits.length(); k++) {
            if (Character.digit(digits.charAt(k), radix) < 0) {
                return null;
            }
        }
        BigInteger value = new BigInteger(digits, radix);
        return negative ? value.negate() : value;
    }

    // Finite decimal float; null otherwise.
    private static Double parseFloat(String s) {
        if (!DECIMAL_FLOAT.matcher(s).matches()) {
            return null;
        }
        double f = Double.parseDouble(s);
        return Double.isInfinite(f) ? null : f;
    }

    private static boolean containsAny(String s, String chars) {
        for (int i = 0; i < chars.length(); i++) {
            if (s.indexOf(chars.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    /** Returns the literal as written. */
    public String text() {
        return text;
    }

    public boolean isInt() {
        return isInt;
    }

    public boolean isUint() {
        return isUint;
    }

    public boolean isFloat() {
        return isFloat;
    }

    public boolean isComplex() {
        return isComplex;
    }

    public long intValue() {
        return intValue;
    }

    /** Unsigned 64-bit value, stored in a {@code long}. */
    public long uintValue() {
        return uintValue;
    }

    public double floatValue() {
        return floatValue;
    }

    public double realPart() {
        return realPart;
    }

    public double imaginaryPart() {
        return imaginaryPart;
    }

    @Override
    public String render(TextFormat format) {
        return text;
    }

    @Override
    public NumberNode copy() {
        NumberNode copy = new NumberNode(position(), source(), text);
        copy.isInt = isInt;
        copy.isUint = isUint;
        copy.isFloat = isFloat;
        copy.isComplex = isComplex;
        copy.intValue = intValue;
        copy.uintValue = uintValue;
        copy.floatValue = floatValue;
        copy.realPart = realPart;
        copy.imaginaryPart = imaginaryPart;
        return copy;
    }
}
