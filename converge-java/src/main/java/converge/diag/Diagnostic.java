package converge.diag;

import java.util.Objects;

/**
 * A user-facing defect found by one of the front-end stages. Diagnostics are
 * values; no stage throws for malformed user input.
 */
public record Diagnostic(Kind kind, String message, Span span) {

    public enum Kind {
        LEX_ERROR("LexError"),
        PARSE_ERROR("ParseError"),
        VALIDATION_ERROR("ValidationError");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public Diagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(span, "span");
    }

    public static Diagnostic lex(String message, Span span) {
        return new Diagnostic(Kind.LEX_ERROR, message, span);
    }

    public static Diagnostic parse(String message, Span span) {
        return new Diagnostic(Kind.PARSE_ERROR, message, span);
    }

    public static Diagnostic validation(String message, Span span) {
        return new Diagnostic(Kind.VALIDATION_ERROR, message, span);
    }

    @Override
    public String toString() {
        return kind.label() + "@" + span + ": " + message;
    }
}
