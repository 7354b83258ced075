package converge.lexer;

import converge.diag.Diagnostic;
import converge.diag.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

public final class Lexer {
    private static final Logger log = LoggerFactory.getLogger(Lexer.class);

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private int col = 1;

    // token start, for spans
    private int startPos;
    private int startLine;
    private int startCol;

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("neuron", TokenType.NEURON),
            Map.entry("layer", TokenType.LAYER),
            Map.entry("connect", TokenType.CONNECT),
            Map.entry("stimulus", TokenType.STIMULUS),
            Map.entry("run", TokenType.RUN),
            Map.entry("for", TokenType.FOR)
    );

    public Lexer(String source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public static LexResult tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public LexResult tokenize() {
        while (!isAtEnd()) {
            skipWhitespaceAndComments();
            if (isAtEnd()) break;

            startPos = pos;
            startLine = line;
            startCol = col;

            char c = advance();

            switch (c) {
                case '(' -> add(TokenType.LPAREN, "(");
                case ')' -> add(TokenType.RPAREN, ")");
                case '{' -> add(TokenType.LBRACE, "{");
                case '}' -> add(TokenType.RBRACE, "}");
                case '[' -> add(TokenType.LBRACKET, "[");
                case ']' -> add(TokenType.RBRACKET, "]");
                case ':' -> add(TokenType.COLON, ":");
                case ',' -> add(TokenType.COMMA, ",");
                case '=' -> add(TokenType.ASSIGN, "=");

                case '-' -> {
                    if (match('>')) add(TokenType.ARROW, "->");
                    else if (isDigit(peek())) numberLiteral();
                    else error("unexpected character '-'");
                }

                case '"' -> stringLiteral();

                default -> {
                    if (isDigit(c)) numberLiteral();
                    else if (isAlpha(c)) identifier();
                    else unexpectedCharacter(c);
                }
            }
        }

        startPos = pos;
        startLine = line;
        startCol = col;
        add(TokenType.EOF, "");

        log.debug("Lexed {} tokens, {} diagnostics", tokens.size(), diagnostics.size());
        return new LexResult(tokens, diagnostics);
    }

    // ================= helpers =================

    // the leading '-' or first digit is already consumed
    private void numberLiteral() {
        boolean isFloat = false;

        while (!isAtEnd() && isDigit(peek())) advance();

        if (!isAtEnd() && peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance();
            while (!isAtEnd() && isDigit(peek())) advance();
        }

        add(isFloat ? TokenType.FLOAT_LITERAL : TokenType.INT_LITERAL, source.substring(startPos, pos));
    }

    private void identifier() {
        while (!isAtEnd() && isAlphaNumeric(peek())) advance();

        String text = source.substring(startPos, pos);
        add(keywords.getOrDefault(text, TokenType.IDENTIFIER), text);
    }

    // one diagnostic per malformed literal; a bad literal yields no token
    private void stringLiteral() {
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\n') {
                error("unterminated string literal");
                return; // resume at the newline
            }
            char c = advance();
            if (c != '\\') {
                sb.append(c);
                continue;
            }

            if (isAtEnd() || peek() == '\n') {
                error("unterminated string literal");
                return;
            }

            int escPos = pos - 1;
            int escLine = line;
            int escCol = col - 1;
            char e = peek();
            switch (e) {
                case '"' -> sb.append('"');
                case '\\' -> sb.append('\\');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                default -> {
                    diagnostics.add(Diagnostic.lex(
                            "invalid escape sequence '\\" + printable(e) + "' in string literal",
                            new Span(escPos, pos + 1, escLine, escCol)));
                    skipRestOfString();
                    return;
                }
            }
            advance();
        }

        if (isAtEnd()) {
            error("unterminated string literal");
            return;
        }

        advance(); // closing "
        add(TokenType.STRING_LITERAL, sb.toString());
    }

    private void skipRestOfString() {
        while (!isAtEnd() && peek() != '\n') {
            char c = advance();
            if (c == '"') return;
            if (c == '\\' && !isAtEnd() && peek() != '\n') advance();
        }
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            switch (c) {
                case ' ', '\t', '\r', '\n' -> advance();
                case '/' -> {
                    if (peekNext() != '/') return;
                    while (!isAtEnd() && peek() != '\n') advance();
                }
                default -> { return; }
            }
        }
    }

    // a surrogate pair is one character and one column
    private void unexpectedCharacter(char c) {
        String text = printable(c);
        if (Character.isHighSurrogate(c) && Character.isLowSurrogate(peek())) {
            pos++;
            text = source.substring(startPos, pos);
        }
        error("unexpected character '" + text + "'");
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private static String printable(char c) {
        if (c < 0x20 || c == 0x7f) return String.format("\\u%04x", (int) c);
        return String.valueOf(c);
    }

    private Span currentSpan() {
        return new Span(startPos, pos, startLine, startCol);
    }

    private void add(TokenType type, String lexeme) {
        tokens.add(new Token(type, lexeme, currentSpan()));
    }

    private void error(String message) {
        diagnostics.add(Diagnostic.lex(message, currentSpan()));
    }
}
