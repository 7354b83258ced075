package converge.sema;

import converge.ast.Ident;
import converge.ast.Program;
import converge.diag.Diagnostic;
import converge.diag.Span;
import converge.parser.ParseResult;
import converge.parser.Parser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class ValidatorTest {

    private static Program parse(String src) {
        ParseResult r = Parser.parse(src);
        assertTrue(r.isSuccess(), () -> "unexpected syntax errors: " + r.diagnostics());
        return r.program();
    }

    private static List<Diagnostic> validate(String src) {
        return Validator.validate(parse(src)).diagnostics();
    }

    @Test
    void valid_program_has_no_diagnostics() {
        var r = Validator.validate(parse("""
            neuron LIF { tau_m = 20 ms }
            layer Input[10]: LIF
            layer Out[2]: LIF
            connect Input -> Out { w = 0.5 }
            stimulus Input = Poisson(rate = 10 Hz)
            run for 5 ms
            """));
        assertTrue(r.isSuccess(), r.diagnostics().toString());
    }

    @Test
    void references_may_precede_declarations() {
        assertTrue(validate("""
            connect A -> B {}
            layer A[1]: N
            layer B[1]: N
            neuron N {}
            """).isEmpty());
    }

    @Test
    void unknown_neuron_type_reports_once_naming_it() {
        var ds = validate("layer A[1]: Ghost");
        assertEquals(1, ds.size());
        var d = ds.get(0);
        assertEquals(Diagnostic.Kind.VALIDATION_ERROR, d.kind());
        assertTrue(d.message().contains("Ghost"));
        // anchored at the reference, not the layer name
        assertEquals(13, d.span().column());
    }

    @Test
    void duplicate_neuron_flags_only_the_second() {
        var ds = validate("neuron N{} neuron N{}");
        assertEquals(1, ds.size());
        assertTrue(ds.get(0).message().startsWith("duplicate neuron 'N'"));
        assertEquals(19, ds.get(0).span().column());
        assertTrue(ds.get(0).message().contains("first declared at 1:8"));
    }

    @Test
    void n_duplicates_yield_n_minus_one_diagnostics() {
        var ds = validate("neuron N{} neuron N{} neuron N{} neuron N{}");
        assertEquals(3, ds.size());
    }

    @Test
    void neuron_and_layer_namespaces_are_separate() {
        assertTrue(validate("neuron X {} layer X[1]: X").isEmpty());
    }

    @Test
    void connect_checks_both_ends() {
        var ds = validate("""
            neuron N {}
            layer A[1]: N
            connect A -> Nope {}
            connect Gone -> Nope {}
            """);
        assertEquals(3, ds.size());
        assertEquals("unknown destination layer 'Nope'", ds.get(0).message());
        assertEquals("unknown source layer 'Gone'", ds.get(1).message());
        assertEquals("unknown destination layer 'Nope'", ds.get(2).message());
    }

    @Test
    void stimulus_layer_must_exist() {
        var ds = validate("stimulus Missing = Poisson(rate = 5 Hz)");
        assertEquals(1, ds.size());
        assertEquals("unknown stimulus layer 'Missing'", ds.get(0).message());
    }

    @Test
    void a_layer_reference_to_a_neuron_name_does_not_resolve() {
        var ds = validate("neuron N {} connect N -> N {}");
        assertEquals(2, ds.size());
    }

    static Stream<Arguments> defectCounts() {
        return Stream.of(
                Arguments.of("neuron N {} layer A[1]: N run for 1 ms", 0),
                Arguments.of("layer A[1]: X layer A[1]: Y", 3),
                Arguments.of("neuron N {} neuron N {} layer L[1]: M connect L -> Q {}", 3),
                Arguments.of("layer L[1]: N layer L[1]: N layer L[1]: N neuron N {}", 2),
                Arguments.of("connect A -> B {} connect B -> A {} stimulus C = Poisson(rate = 1 Hz)", 5)
        );
    }

    @ParameterizedTest
    @MethodSource("defectCounts")
    void reports_exactly_one_diagnostic_per_defect(String src, int defects) {
        var ds = validate(src);
        assertEquals(defects, ds.size(), ds.toString());
    }

    @Test
    void validation_is_repeatable_on_the_same_program() {
        Program p = parse("layer A[1]: X layer A[1]: X");
        assertEquals(Validator.validate(p), Validator.validate(p));
    }

    @Test
    void symbol_table_keeps_first_declaration() {
        SymbolTable table = new SymbolTable();
        Ident first = new Ident("N", new Span(0, 1, 1, 1));
        Ident second = new Ident("N", new Span(5, 6, 1, 6));

        assertNull(table.define(SymbolKind.NEURON, first));
        assertSame(first, table.define(SymbolKind.NEURON, second));
        assertSame(first, table.lookup(SymbolKind.NEURON, "N"));
        assertFalse(table.isDefined(SymbolKind.LAYER, "N"));
    }
}
