package converge.lexer;

public enum TokenType {

    // literals
    IDENTIFIER,
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,

    // keywords
    NEURON,
    LAYER,
    CONNECT,
    STIMULUS,
    RUN,
    FOR,

    // symbols
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    LBRACKET, RBRACKET,
    COLON, COMMA,
    ASSIGN,
    ARROW,

    EOF;

    /** Keywords that open a top-level item; the parser resynchronises on these. */
    public boolean startsItem() {
        return this == NEURON || this == LAYER || this == CONNECT || this == STIMULUS || this == RUN;
    }

    public boolean isNumber() {
        return this == INT_LITERAL || this == FLOAT_LITERAL;
    }
}
