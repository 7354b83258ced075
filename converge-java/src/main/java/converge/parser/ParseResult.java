package converge.parser;

import converge.ast.Program;
import converge.diag.Diagnostic;

import java.util.List;

/**
 * When diagnostics are present, {@code program} holds only the items that
 * parsed cleanly and must not be handed to the emitter.
 */
public record ParseResult(Program program, List<Diagnostic> diagnostics) {

    public ParseResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isSuccess() {
        return diagnostics.isEmpty();
    }
}
