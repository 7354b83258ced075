package converge.cvir;

import converge.ast.Ident;
import converge.ast.Program;
import converge.ast.expr.CallExpr;
import converge.ast.expr.Quantity;
import converge.ast.item.RunStmt;
import converge.ast.item.StimulusDef;
import converge.config.ConvergeConfig;
import converge.diag.InternalCompilerError;
import converge.diag.Span;
import converge.parser.ParseResult;
import converge.parser.Parser;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CvirEmitterTest {

    private static CvirDocument emit(String src) {
        ParseResult r = Parser.parse(src);
        assertTrue(r.isSuccess(), () -> "unexpected diagnostics: " + r.diagnostics());
        return new CvirEmitter().emit(r.program());
    }

    private static List<String> kinds(CvirDocument doc) {
        return doc.items().stream().map(i -> i.getClass().getSimpleName()).toList();
    }

    @Test
    void emit_hello_program() {
        var doc = emit("""
            neuron LIF { tau_m = 20 ms }
            layer Input[10]: LIF
            run for 5 ms
            """);
        assertEquals("0.2", doc.cvirVersion());
        assertEquals(List.of("Neuron", "Layer", "Run"), kinds(doc));

        var neuron = (CvirItem.Neuron) doc.items().get(0);
        assertEquals("LIF", neuron.name());
        assertEquals(Map.of("tau_m", new CvirQuantity(20L, "ms")), neuron.params());

        var layer = (CvirItem.Layer) doc.items().get(1);
        assertEquals(new CvirItem.Layer("Input", 10, "LIF"), layer);

        var run = (CvirItem.Run) doc.items().get(2);
        assertEquals(new CvirQuantity(5L, "ms"), run.duration());
    }

    @Test
    void emit_preserves_source_order() {
        var doc = emit("""
            run for 1 ms
            layer B[1]: N
            connect B -> A {}
            neuron N {}
            layer A[1]: N
            """);
        assertEquals(List.of("Run", "Layer", "Connect", "Neuron", "Layer"), kinds(doc));
        assertEquals("B", ((CvirItem.Layer) doc.items().get(1)).name());
        assertEquals("A", ((CvirItem.Layer) doc.items().get(4)).name());
    }

    @Test
    void emit_run_defaults_for_step_and_seed() {
        var run = (CvirItem.Run) emit("run for 5 ms").items().get(0);
        assertEquals(new CvirQuantity(1L, "ms"), run.step());
        assertEquals(0, run.seed());
    }

    @Test
    void emit_run_explicit_step_and_seed() {
        var run = (CvirItem.Run) emit("run for 5 ms step 0.5 ms seed 7").items().get(0);
        assertEquals(new CvirQuantity(new BigDecimal("0.5"), "ms"), run.step());
        assertEquals(7, run.seed());
    }

    @Test
    void emit_seed_statement_before_or_after_run() {
        var before = (CvirItem.Run) emit("seed 42\nrun for 10 ms step 1 ms").items().get(0);
        assertEquals(42, before.seed());

        var doc = emit("run for 10 ms step 1 ms\nseed 42");
        assertEquals(List.of("Run"), kinds(doc));
        assertEquals(42, ((CvirItem.Run) doc.items().get(0)).seed());
    }

    @Test
    void emit_run_defaults_come_from_config() {
        var config = new ConvergeConfig(true, new CvirQuantity(new BigDecimal("0.1"), "ms"), 99);
        var span = new Span(0, 1, 1, 1);
        var program = new Program(List.of(new RunStmt(
                new Quantity(10L, new Ident("s", span), span), null, null)));

        var run = (CvirItem.Run) new CvirEmitter(config).emit(program).items().get(0);
        assertEquals(new CvirQuantity(10L, "s"), run.duration());
        assertEquals(new CvirQuantity(new BigDecimal("0.1"), "ms"), run.step());
        assertEquals(99, run.seed());
    }

    @Test
    void emit_params_keep_assignment_order_and_value_shapes() {
        var neuron = (CvirItem.Neuron) emit("""
            neuron N {
              z = 1
              label = "exc"
              reset = Zero
              a = Normal(1 ms, sd = 2)
            }
            """).items().get(0);
        assertEquals(List.of("z", "label", "reset", "a"), List.copyOf(neuron.params().keySet()));
        assertEquals(new CvirQuantity(1L, null), neuron.params().get("z"));
        assertEquals("exc", neuron.params().get("label"));
        assertEquals(new CvirValue.Ident("Zero"), neuron.params().get("reset"));
        assertEquals(new CvirValue.Call("Normal",
                        List.of(new CvirQuantity(1L, "ms")),
                        Map.of("sd", new CvirQuantity(2L, null))),
                neuron.params().get("a"));
    }

    @Test
    void emit_repeated_key_keeps_first_position_and_last_value() {
        var neuron = (CvirItem.Neuron) emit("neuron N { a = 1, b = 2, a = 3 }").items().get(0);
        assertEquals(List.of("a", "b"), List.copyOf(neuron.params().keySet()));
        assertEquals(new CvirQuantity(3L, null), neuron.params().get("a"));
    }

    @Test
    void emit_connect_and_stimulus() {
        var doc = emit("""
            connect In -> Out { w = 0.25, d = 1 ms }
            stimulus In = Poisson(rate = 50 Hz, start = 10 ms)
            """);
        var c = (CvirItem.Connect) doc.items().get(0);
        assertEquals("In", c.from());
        assertEquals("Out", c.to());
        assertEquals(new CvirQuantity(new BigDecimal("0.25"), null), c.params().get("w"));

        var s = (CvirItem.Stimulus) doc.items().get(1);
        assertEquals("In", s.layer());
        assertEquals("Poisson", s.model().type());
        assertEquals(new CvirQuantity(50L, "Hz"), s.model().rate());
        assertEquals(Map.of("start", new CvirQuantity(10L, "ms")), s.model().fields());
    }

    @Test
    void emit_rejects_stimulus_field_that_would_shadow_type() {
        var span = new Span(0, 1, 1, 1);
        var rate = new Quantity(1L, new Ident("Hz", span), span);
        var typeArg = new CallExpr.NamedArg(new Ident("type", span), new Quantity(3L, null, span));
        var program = new Program(List.of(new StimulusDef(new Ident("In", span),
                new StimulusDef.Model(new Ident("Poisson", span), rate, List.of(typeArg)))));

        assertThrows(InternalCompilerError.class, () -> new CvirEmitter().emit(program));
    }

    @Test
    void emit_does_not_validate() {
        // dangling references and duplicates pass straight through
        var doc = emit("layer A[1]: Ghost layer A[2]: Ghost");
        assertEquals(2, doc.items().size());
    }

    @Test
    void emit_is_independent_of_formatting_and_comments() {
        var a = emit("neuron LIF { tau_m = 20 ms } layer Input[10]: LIF run for 5 ms");
        var b = emit("""
            // leaky integrate-and-fire
            neuron   LIF {
                tau_m   =   20   ms,   // membrane
            }

            layer Input [ 10 ] : LIF
            run   for 5 ms
            """);
        assertEquals(a, b);
    }
}
