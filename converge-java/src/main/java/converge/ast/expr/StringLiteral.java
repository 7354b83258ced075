package converge.ast.expr;

import converge.diag.Span;

public record StringLiteral(String value, Span span) implements Expr {}
