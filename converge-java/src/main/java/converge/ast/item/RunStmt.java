package converge.ast.item;

import converge.ast.expr.Quantity;

/**
 * @param step {@code null} unless a {@code step} clause was written
 * @param seed {@code null} unless a {@code seed} clause was written
 */
public record RunStmt(
        Quantity duration,
        Quantity step,
        Long seed
) implements Item {}
