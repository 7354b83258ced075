package converge.ast;

import converge.diag.Span;

public record Ident(String name, Span span) {

    @Override
    public String toString() {
        return name;
    }
}
