package converge.pipeline;

import converge.ast.item.RunStmt;
import converge.diag.Diagnostic;
import converge.io.CvirWriter;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

public class CompilerTest {

    private static final String HELLO = """
            neuron LIF { tau_m = 20 ms }
            layer Input[10]: LIF
            run for 5 ms
            """;

    private final Compiler compiler = new Compiler();

    private static String example(String name) throws IOException {
        try (InputStream in = CompilerTest.class.getResourceAsStream("/examples/" + name)) {
            assertNotNull(in, name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void bundled_examples_compile() throws IOException {
        var hello = compiler.compile(example("hello.cv"));
        assertTrue(hello.isSuccess(), hello.diagnostics().toString());

        var poisson = compiler.compile(example("poisson.cv"));
        assertTrue(poisson.isSuccess(), poisson.diagnostics().toString());
        String json = CvirWriter.toJson(poisson.document(), false);
        assertTrue(json.contains("{\"kind\":\"run\",\"duration\":{\"value\":100,\"unit\":\"ms\"},"
                + "\"step\":{\"value\":0.1,\"unit\":\"ms\"},\"seed\":7}"), json);
        assertTrue(json.contains("\"v_th\":{\"value\":1.0}"), json);
    }

    @Test
    void compile_clean_program_produces_document() {
        var r = compiler.compile(HELLO);
        assertTrue(r.isSuccess());
        assertTrue(r.cvir().isPresent());
        assertEquals(3, r.document().items().size());
        assertEquals(3, r.program().items().size());
    }

    @Test
    void check_never_emits() {
        var r = compiler.check(HELLO);
        assertTrue(r.isSuccess());
        assertNull(r.document());
    }

    @Test
    void compile_is_deterministic() {
        String a = CvirWriter.toJson(compiler.compile(HELLO).document(), true);
        String b = CvirWriter.toJson(new Compiler().compile(HELLO).document(), true);
        assertEquals(a, b);
    }

    @Test
    void validation_errors_block_emission() {
        var r = compiler.compile("layer A[1]: Ghost");
        assertFalse(r.isSuccess());
        assertEquals(1, r.diagnostics().size());
        assertEquals(Diagnostic.Kind.VALIDATION_ERROR, r.diagnostics().get(0).kind());
        assertNull(r.document());
    }

    @Test
    void unterminated_string_reports_one_lex_error_and_parsing_continues() {
        var r = compiler.compile("""
                neuron N { label = "oops
                }
                layer A[1] N
                run for 1 ms
                """);
        long lexErrors = r.diagnostics().stream().filter(d -> d.kind() == Diagnostic.Kind.LEX_ERROR).count();
        assertEquals(1, lexErrors);
        // the parser kept going: it reached and reported the malformed layer on line 3
        assertTrue(r.diagnostics().stream().anyMatch(d ->
                d.kind() == Diagnostic.Kind.PARSE_ERROR && d.span().line() == 3), r.diagnostics().toString());
        // and the trailing run statement was still parsed
        assertTrue(r.program().items().stream().anyMatch(i -> i instanceof RunStmt));
    }

    @Test
    void syntax_errors_skip_validation() {
        // Ghost would be a validation error, but the syntax error comes first
        var r = compiler.compile("layer A[1]: Ghost\nlayer B[: X");
        assertEquals(1, r.diagnostics().size());
        assertEquals(Diagnostic.Kind.PARSE_ERROR, r.diagnostics().get(0).kind());
    }

    @Test
    void lex_diagnostics_come_before_parse_diagnostics() {
        var r = compiler.compile("layer A[: N\nneuron N { s = \"\\q\" }");
        var kinds = r.diagnostics().stream().map(Diagnostic::kind).toList();
        // the dropped literal also leaves 's =' without a value
        assertEquals(List.of(Diagnostic.Kind.LEX_ERROR, Diagnostic.Kind.PARSE_ERROR, Diagnostic.Kind.PARSE_ERROR), kinds);
    }

    @Test
    void independent_compilations_run_in_parallel() throws Exception {
        List<String> sources = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            sources.add("neuron N" + i + " { v = " + i + ".0 mV }\nlayer L[" + i + "]: N" + i + "\nrun for " + i + " ms\n");
        }
        List<String> expected = new ArrayList<>();
        for (String s : sources) expected.add(CvirWriter.toJson(compiler.compile(s).document(), false));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (String s : sources) {
                futures.add(pool.submit(() -> CvirWriter.toJson(compiler.compile(s).document(), false)));
            }
            for (int i = 0; i < sources.size(); i++) {
                assertEquals(expected.get(i), futures.get(i).get());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
