package converge.parser;

import converge.diag.Diagnostic;

/** Aborts the current top-level item; never escapes {@link Parser#parse()}. */
final class ParseException extends RuntimeException {
    private final transient Diagnostic diagnostic;

    ParseException(Diagnostic diagnostic) {
        super(diagnostic.message(), null, false, false);
        this.diagnostic = diagnostic;
    }

    Diagnostic diagnostic() {
        return diagnostic;
    }
}
