package converge.ast;

import converge.ast.expr.*;
import converge.ast.item.*;
import converge.diag.InternalCompilerError;
import converge.lexer.NumberLiterals;

import java.util.List;

/**
 * Prints a program back as source text in one canonical layout. Parsing the
 * output yields a program that emits the same CVIR as the original.
 */
public final class AstPrinter {
    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();

    private AstPrinter() {}

    public static String print(Program program) {
        AstPrinter p = new AstPrinter();
        for (Item item : program.items()) p.item(item);
        return p.out.toString();
    }

    private void item(Item item) {
        if (item instanceof NeuronDef n) {
            out.append("neuron ").append(n.name().name()).append(' ');
            body(n.body());
        } else if (item instanceof LayerDef l) {
            out.append("layer ").append(l.name().name())
                    .append('[').append(l.size()).append("]: ")
                    .append(l.neuronType().name());
        } else if (item instanceof ConnectDef c) {
            out.append("connect ").append(c.from().name()).append(" -> ").append(c.to().name()).append(' ');
            body(c.body());
        } else if (item instanceof StimulusDef s) {
            out.append("stimulus ").append(s.layer().name()).append(" = ")
                    .append(s.model().type().name()).append("(rate = ");
            expr(s.model().rate());
            for (CallExpr.NamedArg arg : s.model().params()) {
                out.append(", ").append(arg.name().name()).append(" = ");
                expr(arg.value());
            }
            out.append(')');
        } else if (item instanceof RunStmt r) {
            out.append("run for ");
            expr(r.duration());
            if (r.step() != null) {
                out.append(" step ");
                expr(r.step());
            }
            if (r.seed() != null) out.append(" seed ").append(r.seed());
        } else {
            throw new InternalCompilerError("Unknown item: " + item.getClass().getName());
        }
        out.append('\n');
    }

    private void body(List<Assign> body) {
        if (body.isEmpty()) {
            out.append("{}");
            return;
        }
        out.append("{\n");
        for (Assign a : body) {
            out.append(INDENT).append(a.name().name()).append(" = ");
            expr(a.value());
            out.append('\n');
        }
        out.append('}');
    }

    private void expr(Expr e) {
        if (e instanceof Quantity q) {
            out.append(NumberLiterals.format(q.value()));
            if (q.unit() != null) out.append(' ').append(q.unit().name());
        } else if (e instanceof StringLiteral s) {
            string(s.value());
        } else if (e instanceof IdentExpr id) {
            out.append(id.ident().name());
        } else if (e instanceof CallExpr c) {
            out.append(c.callee().name()).append('(');
            String sep = "";
            for (Expr arg : c.positional()) {
                out.append(sep);
                expr(arg);
                sep = ", ";
            }
            for (CallExpr.NamedArg arg : c.named()) {
                out.append(sep).append(arg.name().name()).append(" = ");
                expr(arg.value());
                sep = ", ";
            }
            out.append(')');
        } else {
            throw new InternalCompilerError("Unknown expression: " + e.getClass().getName());
        }
    }

    private void string(String s) {
        out.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> out.append(c);
            }
        }
        out.append('"');
    }
}
