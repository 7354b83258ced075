package converge.diag;

/**
 * Broken invariant inside the front-end itself, never caused by user input.
 * Kept apart from {@link Diagnostic} so callers can tell the two apart.
 */
public final class InternalCompilerError extends RuntimeException {

    public InternalCompilerError(String message) {
        super(message);
    }

    public InternalCompilerError(String message, Throwable cause) {
        super(message, cause);
    }
}
