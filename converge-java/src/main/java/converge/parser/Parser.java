package converge.parser;

import converge.ast.Assign;
import converge.ast.Ident;
import converge.ast.Program;
import converge.ast.expr.*;
import converge.ast.item.*;
import converge.diag.Diagnostic;
import converge.diag.InternalCompilerError;
import converge.lexer.LexResult;
import converge.lexer.Lexer;
import converge.lexer.NumberLiterals;
import converge.lexer.Token;
import converge.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Predictive recursive-descent parser. A syntax error abandons the current
 * top-level item, records one diagnostic and skips ahead to the next item
 * keyword, so one pass reports every independent syntax error.
 */
public final class Parser {
    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private static final String STEP = "step";
    private static final String SEED = "seed";
    private static final Set<String> RUN_CLAUSES = Set.of(STEP, SEED);

    private static final String POISSON = "Poisson";
    private static final String RATE = "rate";
    private static final String TYPE = "type";

    private final List<Token> tokens;
    private List<Diagnostic> diagnostics;
    private Token seedValue; // value token of the top-level seed statement, if any
    private int pos;

    public Parser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new InternalCompilerError("Token stream must end with EOF");
        }
        this.tokens = tokens;
    }

    /** Convenience for callers that only care about syntax: lexes, then parses. */
    public static ParseResult parse(String source) {
        LexResult lexed = Lexer.tokenize(source);
        ParseResult parsed = new Parser(lexed.tokens()).parse();
        List<Diagnostic> all = new ArrayList<>(lexed.diagnostics());
        all.addAll(parsed.diagnostics());
        return new ParseResult(parsed.program(), all);
    }

    // ---------- entry ----------
    public ParseResult parse() {
        pos = 0;
        diagnostics = new ArrayList<>();
        seedValue = null;
        List<Item> items = new ArrayList<>();

        while (!check(TokenType.EOF)) {
            int itemStart = pos;
            try {
                if (checkWord(SEED)) {
                    parseSeedStmt();
                } else {
                    items.add(parseItem());
                }
            } catch (ParseException e) {
                diagnostics.add(e.diagnostic());
                synchronize(itemStart);
            }
        }
        applySeedStatement(items);

        log.debug("Parsed {} items, {} diagnostics", items.size(), diagnostics.size());
        return new ParseResult(new Program(items), diagnostics);
    }

    private Item parseItem() {
        if (match(TokenType.NEURON)) return parseNeuronDef();
        if (match(TokenType.LAYER)) return parseLayerDef();
        if (match(TokenType.CONNECT)) return parseConnectDef();
        if (match(TokenType.STIMULUS)) return parseStimulusDef();
        if (match(TokenType.RUN)) return parseRunStmt();
        throw error(peek(), "top-level item ('neuron', 'layer', 'connect', 'stimulus', 'run' or 'seed')");
    }

    private void synchronize(int itemStart) {
        if (pos == itemStart) advance();
        while (!check(TokenType.EOF) && !peek().type().startsItem() && !atSeedStatement()) advance();
    }

    // 'seed' is only a keyword at item level, so recovery stops at it only when a number follows
    private boolean atSeedStatement() {
        return checkWord(SEED) && checkNext(TokenType.INT_LITERAL);
    }

    // ---------- items ----------
    private NeuronDef parseNeuronDef() {
        Ident name = ident("neuron name");
        List<Assign> body = parseAssignBlock();
        return new NeuronDef(name, body);
    }

    private LayerDef parseLayerDef() {
        Ident name = ident("layer name");
        consume(TokenType.LBRACKET, "'[' after layer name");
        long size = unsignedInt("layer size");
        consume(TokenType.RBRACKET, "']' after layer size");
        consume(TokenType.COLON, "':' before neuron type");
        Ident neuronType = ident("neuron type");
        return new LayerDef(name, size, neuronType);
    }

    private ConnectDef parseConnectDef() {
        Ident from = ident("source layer");
        consume(TokenType.ARROW, "'->' between layers");
        Ident to = ident("destination layer");
        List<Assign> body = parseAssignBlock();
        return new ConnectDef(from, to, body);
    }

    private StimulusDef parseStimulusDef() {
        Ident layer = ident("stimulus layer");
        consume(TokenType.ASSIGN, "'=' after stimulus layer");

        Token start = peek();
        Expr e = parseExpr();
        if (!(e instanceof CallExpr call)) {
            throw error(start, "stimulus model call such as Poisson(rate = 10 Hz)");
        }
        if (!call.callee().name().equals(POISSON)) {
            throw new ParseException(Diagnostic.parse(
                    "unknown stimulus model '" + call.callee().name() + "' (expected " + POISSON + ")",
                    call.callee().span()));
        }
        if (!call.positional().isEmpty()) {
            throw new ParseException(Diagnostic.parse(
                    "stimulus model arguments must be named", call.positional().get(0).span()));
        }

        Quantity rate = null;
        List<CallExpr.NamedArg> params = new ArrayList<>();
        for (CallExpr.NamedArg arg : call.named()) {
            if (arg.name().name().equals(TYPE)) {
                throw new ParseException(Diagnostic.parse(
                        "'" + TYPE + "' is reserved and cannot be a stimulus model argument", arg.name().span()));
            }
            if (!arg.name().name().equals(RATE)) {
                params.add(arg);
            } else if (arg.value() instanceof Quantity q) {
                rate = q;
            } else {
                throw new ParseException(Diagnostic.parse("'rate' must be a quantity", arg.value().span()));
            }
        }
        if (rate == null) {
            throw new ParseException(Diagnostic.parse(
                    POISSON + " stimulus requires a 'rate' argument", call.span()));
        }
        return new StimulusDef(layer, new StimulusDef.Model(call.callee(), rate, params));
    }

    private RunStmt parseRunStmt() {
        consume(TokenType.FOR, "'for' after 'run'");
        Quantity duration = parseQuantity("run duration", RUN_CLAUSES);

        Quantity step = null;
        if (checkWord(STEP)) {
            advance();
            step = parseQuantity("run step", RUN_CLAUSES);
        }
        Long seed = null;
        if (checkWord(SEED)) {
            advance();
            seed = unsignedInt("seed value");
        }
        return new RunStmt(duration, step, seed);
    }

    private void parseSeedStmt() {
        Token keyword = advance();
        Token value = peek();
        unsignedInt("seed value");
        if (seedValue != null) {
            throw new ParseException(Diagnostic.parse(
                    "only one 'seed' statement is allowed", keyword.span().to(value.span())));
        }
        seedValue = value;
    }

    /**
     * A top-level {@code seed N} sets the seed of every run statement. A run
     * that also carries its own {@code seed} clause is a conflict.
     */
    private void applySeedStatement(List<Item> items) {
        if (seedValue == null) return;
        long seed = Long.parseLong(seedValue.lexeme());

        boolean sawRun = false;
        for (int i = 0; i < items.size(); i++) {
            if (!(items.get(i) instanceof RunStmt r)) continue;
            sawRun = true;
            if (r.seed() != null) {
                diagnostics.add(Diagnostic.parse(
                        "seed given both by a 'seed' statement and by a 'run' seed clause", seedValue.span()));
            } else {
                items.set(i, new RunStmt(r.duration(), r.step(), seed));
            }
        }
        if (!sawRun && diagnostics.isEmpty()) {
            diagnostics.add(Diagnostic.parse("'seed' statement without a 'run' statement", seedValue.span()));
        }
    }

    // ---------- bodies ----------
    private List<Assign> parseAssignBlock() {
        consume(TokenType.LBRACE, "'{'");
        List<Assign> body = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            if (!check(TokenType.IDENTIFIER)) {
                throw error(peek(), "field assignment or '}'");
            }
            body.add(parseAssign());
            match(TokenType.COMMA);
        }
        consume(TokenType.RBRACE, "'}'");
        return body;
    }

    private Assign parseAssign() {
        Ident name = ident("field name");
        consume(TokenType.ASSIGN, "'=' after field name");
        return new Assign(name, parseExpr());
    }

    // ---------- expressions ----------
    private Expr parseExpr() {
        Token t = peek();
        if (t.type().isNumber()) return parseQuantity("number", Set.of());
        if (match(TokenType.STRING_LITERAL)) return new StringLiteral(t.lexeme(), t.span());
        if (check(TokenType.IDENTIFIER)) {
            Ident name = ident("identifier");
            if (check(TokenType.LPAREN)) return parseCall(name);
            return new IdentExpr(name);
        }
        throw error(t, "expression");
    }

    private CallExpr parseCall(Ident callee) {
        consume(TokenType.LPAREN, "'('");
        List<Expr> positional = new ArrayList<>();
        List<CallExpr.NamedArg> named = new ArrayList<>();

        while (!check(TokenType.RPAREN)) {
            if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ASSIGN)) {
                Ident name = ident("argument name");
                advance(); // '='
                named.add(new CallExpr.NamedArg(name, parseExpr()));
            } else {
                positional.add(parseExpr());
            }
            if (!match(TokenType.COMMA)) break;
        }

        Token close = consume(TokenType.RPAREN, "',' or ')' in argument list");
        return new CallExpr(callee, positional, named, callee.span().to(close.span()));
    }

    /**
     * An identifier right after the number is its unit, unless it begins the
     * next assignment ({@code x =}) or is one of {@code clauses}.
     */
    private Quantity parseQuantity(String what, Set<String> clauses) {
        Token num = peek();
        if (!num.type().isNumber()) throw error(num, what);
        advance();

        Ident unit = null;
        if (check(TokenType.IDENTIFIER)
                && !checkNext(TokenType.ASSIGN)
                && !clauses.contains(peek().lexeme())) {
            unit = ident("unit");
        }
        var span = unit == null ? num.span() : num.span().to(unit.span());
        return new Quantity(NumberLiterals.toNumber(num), unit, span);
    }

    private long unsignedInt(String what) {
        Token t = peek();
        if (t.type() != TokenType.INT_LITERAL || t.lexeme().startsWith("-")) {
            throw error(t, "non-negative integer " + what);
        }
        advance();
        BigInteger v = new BigInteger(t.lexeme());
        if (v.bitLength() >= Long.SIZE) {
            throw new ParseException(Diagnostic.parse(what + " '" + t.lexeme() + "' is out of range", t.span()));
        }
        return v.longValue();
    }

    private Ident ident(String what) {
        Token t = consume(TokenType.IDENTIFIER, what);
        return new Ident(t.lexeme(), t.span());
    }

    // ---------- helpers ----------
    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    private Token consume(TokenType t, String expected) {
        if (check(t)) return advance();
        throw error(peek(), expected);
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkNext(TokenType t) {
        if (pos + 1 >= tokens.size()) return false;
        return tokens.get(pos + 1).type() == t;
    }

    private boolean checkWord(String word) {
        return check(TokenType.IDENTIFIER) && peek().lexeme().equals(word);
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() { return tokens.get(pos); }
    private Token previous() { return tokens.get(pos - 1); }

    private ParseException error(Token at, String expected) {
        return new ParseException(Diagnostic.parse("expected " + expected + ", found " + describe(at), at.span()));
    }

    private static String describe(Token t) {
        return switch (t.type()) {
            case EOF -> "end of input";
            case IDENTIFIER -> "identifier '" + t.lexeme() + "'";
            case INT_LITERAL, FLOAT_LITERAL -> "number '" + t.lexeme() + "'";
            case STRING_LITERAL -> "string literal";
            default -> "'" + t.lexeme() + "'";
        };
    }
}
