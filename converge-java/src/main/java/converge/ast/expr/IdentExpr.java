package converge.ast.expr;

import converge.ast.Ident;
import converge.diag.Span;

/** Bare identifier reference, e.g. {@code reset = Zero}. */
public record IdentExpr(Ident ident) implements Expr {

    @Override
    public Span span() {
        return ident.span();
    }
}
