package converge.sema;

import converge.ast.Ident;
import converge.ast.Program;
import converge.ast.item.*;
import converge.diag.Diagnostic;
import converge.diag.InternalCompilerError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Cross-declaration checks. Pass one collects neuron and layer names and
 * flags every repeated declaration after the first; pass two resolves every
 * reference against those tables. Both passes always run to completion, so
 * the result holds exactly one diagnostic per defect.
 */
public final class Validator {
    private static final Logger log = LoggerFactory.getLogger(Validator.class);

    private Validator() {}

    public static ValidationResult validate(Program program) {
        SymbolTable table = new SymbolTable();
        List<Diagnostic> diagnostics = new ArrayList<>();

        // 1) declarations
        for (Item item : program.items()) {
            if (item instanceof NeuronDef n) {
                declare(table, SymbolKind.NEURON, n.name(), diagnostics);
            } else if (item instanceof LayerDef l) {
                declare(table, SymbolKind.LAYER, l.name(), diagnostics);
            }
        }

        // 2) references
        for (Item item : program.items()) {
            if (item instanceof LayerDef l) {
                resolve(table, SymbolKind.NEURON, l.neuronType(), "unknown neuron type", diagnostics);
            } else if (item instanceof ConnectDef c) {
                resolve(table, SymbolKind.LAYER, c.from(), "unknown source layer", diagnostics);
                resolve(table, SymbolKind.LAYER, c.to(), "unknown destination layer", diagnostics);
            } else if (item instanceof StimulusDef s) {
                resolve(table, SymbolKind.LAYER, s.layer(), "unknown stimulus layer", diagnostics);
            } else if (!(item instanceof NeuronDef || item instanceof RunStmt)) {
                throw new InternalCompilerError("Unknown item: " + item.getClass().getName());
            }
        }

        log.debug("Validated {} items, {} diagnostics", program.items().size(), diagnostics.size());
        return new ValidationResult(diagnostics);
    }

    private static void declare(SymbolTable table, SymbolKind kind, Ident name, List<Diagnostic> out) {
        Ident first = table.define(kind, name);
        if (first != null) {
            out.add(Diagnostic.validation(
                    "duplicate " + kind.label() + " '" + name.name() + "' (first declared at "
                            + first.span().line() + ":" + first.span().column() + ")",
                    name.span()));
        }
    }

    private static void resolve(SymbolTable table, SymbolKind kind, Ident ref, String what, List<Diagnostic> out) {
        if (!table.isDefined(kind, ref.name())) {
            out.add(Diagnostic.validation(what + " '" + ref.name() + "'", ref.span()));
        }
    }
}
