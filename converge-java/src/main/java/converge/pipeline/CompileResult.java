package converge.pipeline;

import converge.ast.Program;
import converge.cvir.CvirDocument;
import converge.diag.Diagnostic;

import java.util.List;
import java.util.Optional;

/**
 * @param program  parsed program; partial when syntax diagnostics are present
 * @param document {@code null} unless every stage finished without diagnostics
 *                 (and always {@code null} for {@link Compiler#check})
 */
public record CompileResult(
        List<Diagnostic> diagnostics,
        Program program,
        CvirDocument document
) {

    public CompileResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isSuccess() {
        return diagnostics.isEmpty();
    }

    public Optional<CvirDocument> cvir() {
        return Optional.ofNullable(document);
    }
}
