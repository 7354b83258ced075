package converge.sema;

import converge.diag.Diagnostic;

import java.util.List;

public record ValidationResult(List<Diagnostic> diagnostics) {

    public ValidationResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isSuccess() {
        return diagnostics.isEmpty();
    }
}
