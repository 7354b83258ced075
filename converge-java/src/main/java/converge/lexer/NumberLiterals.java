package converge.lexer;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Converts number lexemes to values without losing their written form:
 * integers become {@link Long} (or {@link BigInteger} past the long range),
 * fractional literals become {@link BigDecimal} with the written scale.
 */
public final class NumberLiterals {
    private NumberLiterals() {}

    public static Number toNumber(Token token) {
        return switch (token.type()) {
            case INT_LITERAL -> integer(token.lexeme());
            case FLOAT_LITERAL -> new BigDecimal(token.lexeme());
            default -> throw new IllegalArgumentException("Not a number token: " + token);
        };
    }

    public static Number parse(String text) {
        return text.indexOf('.') >= 0 ? new BigDecimal(text) : integer(text);
    }

    /** Source form of a value produced by this class. */
    public static String format(Number value) {
        if (value instanceof BigDecimal bd) return bd.toPlainString();
        return value.toString();
    }

    public static boolean isInteger(Number value) {
        return value instanceof Long || value instanceof BigInteger;
    }

    private static Number integer(String text) {
        BigInteger big = new BigInteger(text);
        return big.bitLength() < Long.SIZE ? (Number) big.longValue() : big;
    }
}
