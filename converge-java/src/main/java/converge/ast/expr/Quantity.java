package converge.ast.expr;

import converge.ast.Ident;
import converge.diag.Span;
import converge.lexer.NumberLiterals;

import java.util.Objects;

/**
 * A number with an optional unit. The value keeps the literal's written form
 * ({@code Long}/{@code BigInteger} for integers, {@code BigDecimal} for
 * fractional literals); units are carried, never converted.
 *
 * @param unit {@code null} when the literal has no unit
 */
public record Quantity(Number value, Ident unit, Span span) implements Expr {

    public Quantity {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(span, "span");
    }

    public boolean isInteger() {
        return NumberLiterals.isInteger(value);
    }

    public String unitName() {
        return unit == null ? null : unit.name();
    }
}
