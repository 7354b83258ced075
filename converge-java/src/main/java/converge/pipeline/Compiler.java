package converge.pipeline;

import converge.ast.Program;
import converge.config.ConvergeConfig;
import converge.cvir.CvirDocument;
import converge.cvir.CvirEmitter;
import converge.diag.Diagnostic;
import converge.lexer.LexResult;
import converge.lexer.Lexer;
import converge.parser.ParseResult;
import converge.parser.Parser;
import converge.sema.ValidationResult;
import converge.sema.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Source text to CVIR: lex, parse, validate, emit. Validation is skipped when
 * lexing or parsing reported anything, and nothing is emitted unless all
 * earlier stages are clean. Holds no mutable state; one instance can serve
 * any number of threads.
 */
public final class Compiler {
    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    private final CvirEmitter emitter;

    public Compiler() {
        this(ConvergeConfig.defaults());
    }

    public Compiler(ConvergeConfig config) {
        this.emitter = new CvirEmitter(config);
    }

    public CompileResult check(String source) {
        return run(source, false);
    }

    public CompileResult compile(String source) {
        return run(source, true);
    }

    private CompileResult run(String source, boolean emit) {
        LexResult lexed = Lexer.tokenize(source);
        ParseResult parsed = new Parser(lexed.tokens()).parse();

        List<Diagnostic> diagnostics = new ArrayList<>(lexed.diagnostics());
        diagnostics.addAll(parsed.diagnostics());
        Program program = parsed.program();

        if (!diagnostics.isEmpty()) {
            log.debug("Syntax errors: {}, skipping validation", diagnostics.size());
            return new CompileResult(diagnostics, program, null);
        }

        ValidationResult validated = Validator.validate(program);
        diagnostics.addAll(validated.diagnostics());
        if (!diagnostics.isEmpty() || !emit) {
            return new CompileResult(diagnostics, program, null);
        }

        CvirDocument doc = emitter.emit(program);
        return new CompileResult(diagnostics, program, doc);
    }
}
