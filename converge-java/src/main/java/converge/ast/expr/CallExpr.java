package converge.ast.expr;

import converge.ast.Ident;
import converge.diag.Span;

import java.util.List;

public record CallExpr(
        Ident callee,
        List<Expr> positional,
        List<NamedArg> named,
        Span span
) implements Expr {

    public record NamedArg(Ident name, Expr value) {}

    public CallExpr {
        positional = List.copyOf(positional);
        named = List.copyOf(named);
    }
}
