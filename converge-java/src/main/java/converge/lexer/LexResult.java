package converge.lexer;

import converge.diag.Diagnostic;

import java.util.List;

/**
 * Tokens always end with {@link TokenType#EOF}, even when diagnostics were
 * reported; malformed literals are simply absent from the stream.
 */
public record LexResult(List<Token> tokens, List<Diagnostic> diagnostics) {

    public LexResult {
        tokens = List.copyOf(tokens);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isSuccess() {
        return diagnostics.isEmpty();
    }
}
