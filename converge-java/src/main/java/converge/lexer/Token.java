package converge.lexer;

import converge.diag.Span;

/**
 * For {@link TokenType#STRING_LITERAL} the lexeme is the decoded value
 * (quotes removed, escapes applied); for every other type it is the source text.
 */
public record Token(TokenType type, String lexeme, Span span) {

    @Override
    public String toString() {
        return type + "('" + lexeme + "')@" + span.line() + ":" + span.column();
    }
}
