package converge.ast.expr;

import converge.diag.Span;

public sealed interface Expr
        permits Quantity, StringLiteral, IdentExpr, CallExpr {

    Span span();
}
