package converge.cvir;

import converge.ast.Assign;
import converge.ast.Program;
import converge.ast.expr.*;
import converge.ast.item.*;
import converge.config.ConvergeConfig;
import converge.diag.InternalCompilerError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers a program to a CVIR document: one item per source item, in source
 * order, built from AST content only (spans never reach the output).
 * Does not re-check references; validate first to get a sound document.
 */
public final class CvirEmitter {
    private static final Logger log = LoggerFactory.getLogger(CvirEmitter.class);

    public static final String CVIR_VERSION = "0.2";

    private final ConvergeConfig config;

    public CvirEmitter() {
        this(ConvergeConfig.defaults());
    }

    public CvirEmitter(ConvergeConfig config) {
        this.config = config;
    }

    public CvirDocument emit(Program program) {
        List<CvirItem> items = new ArrayList<>(program.items().size());
        for (Item item : program.items()) {
            items.add(lowerItem(item));
        }
        log.debug("Emitted {} CVIR items", items.size());
        return new CvirDocument(CVIR_VERSION, items);
    }

    private CvirItem lowerItem(Item item) {
        if (item instanceof NeuronDef n) {
            return new CvirItem.Neuron(n.name().name(), lowerBody(n.body()));
        }
        if (item instanceof LayerDef l) {
            return new CvirItem.Layer(l.name().name(), l.size(), l.neuronType().name());
        }
        if (item instanceof ConnectDef c) {
            return new CvirItem.Connect(c.from().name(), c.to().name(), lowerBody(c.body()));
        }
        if (item instanceof StimulusDef s) {
            Map<String, Object> fields = new LinkedHashMap<>();
            for (CallExpr.NamedArg arg : s.model().params()) {
                fields.put(arg.name().name(), lowerExpr(arg.value()));
            }
            return new CvirItem.Stimulus(s.layer().name(),
                    new CvirStimulusModel(s.model().type().name(), lowerQuantity(s.model().rate()), fields));
        }
        if (item instanceof RunStmt r) {
            // step and seed are always present in 0.2
            CvirQuantity step = r.step() != null ? lowerQuantity(r.step()) : config.defaultStep();
            long seed = r.seed() != null ? r.seed() : config.defaultSeed();
            return new CvirItem.Run(lowerQuantity(r.duration()), step, seed);
        }
        throw new InternalCompilerError("Unknown item: " + item.getClass().getName());
    }

    // a repeated key keeps its first position and takes the last value
    private Map<String, Object> lowerBody(List<Assign> body) {
        Map<String, Object> params = new LinkedHashMap<>();
        for (Assign a : body) {
            params.put(a.name().name(), lowerExpr(a.value()));
        }
        return params;
    }

    private Object lowerExpr(Expr e) {
        if (e instanceof Quantity q) return lowerQuantity(q);
        if (e instanceof StringLiteral s) return s.value();
        if (e instanceof IdentExpr id) return new CvirValue.Ident(id.ident().name());
        if (e instanceof CallExpr c) {
            List<Object> args = new ArrayList<>();
            for (Expr arg : c.positional()) args.add(lowerExpr(arg));
            Map<String, Object> named = new LinkedHashMap<>();
            for (CallExpr.NamedArg arg : c.named()) named.put(arg.name().name(), lowerExpr(arg.value()));
            return new CvirValue.Call(c.callee().name(), args, named);
        }
        throw new InternalCompilerError("Unknown expression: " + e.getClass().getName());
    }

    private static CvirQuantity lowerQuantity(Quantity q) {
        return new CvirQuantity(q.value(), q.unitName());
    }
}
