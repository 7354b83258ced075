package converge.ast;

import converge.ast.expr.Expr;

/** {@code name = value} inside a neuron or connect body. */
public record Assign(Ident name, Expr value) {}
