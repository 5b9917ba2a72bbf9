package io.vais.lang;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static io.vais.lang.TokenType.*;

/**
 * Recursive-descent parser for unit documents. Fail-fast: the first
 * ungrammatical token raises a {@link ParseException}.
 *
 * <p>The nine blocks must appear in their fixed order. INPUT, OUTPUT, META and
 * INTENT are strict; CONSTRAINT, FLOW, EXECUTION and VERIFY skip tokens they
 * do not recognise (UNKNOWN characters still fail).
 */
public final class Parser {
    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private static final Set<TokenType> UNIT_KINDS = EnumSet.of(FUNCTION, SERVICE, PIPELINE, MODULE);
    private static final Set<TokenType> META_KEYS = EnumSet.of(DOMAIN, DETERMINISM, IDEMPOTENT, PURE, TIMEOUT, RETRY);
    private static final Set<TokenType> GOALS = EnumSet.of(TRANSFORM, VALIDATE, AGGREGATE, FILTER, ROUTE, COMPOSE, FETCH);
    private static final Set<TokenType> PRIORITIES = EnumSet.of(CORRECTNESS, PERFORMANCE, MEMORY, LATENCY, THROUGHPUT);
    private static final Set<TokenType> STRATEGIES = EnumSet.of(ABORT, RETRY, FALLBACK, DEFAULT);
    private static final Set<TokenType> CONSTRAINT_KINDS = EnumSet.of(REQUIRE, FORBID, PREFER, INVARIANT);
    private static final Set<TokenType> OPS = EnumSet.of(
        MAP, FILTER, REDUCE, TRANSFORM, BRANCH, MERGE, SPLIT, JOIN, RACE,
        FETCH, STORE, CALL, EMIT, SUBSCRIBE, VALIDATE, SANITIZE, AUTHORIZE);
    private static final Set<TokenType> TARGETS = EnumSet.of(ANY, CPU, GPU, WASM, NATIVE);
    private static final Set<TokenType> MEMORY_POLICIES = EnumSet.of(BOUNDED, UNBOUNDED, STACK_ONLY);
    private static final Set<TokenType> ISOLATIONS = EnumSet.of(NONE, THREAD, PROCESS, CONTAINER);
    private static final Set<TokenType> CACHES = EnumSet.of(NONE, LRU, TTL);
    private static final Set<TokenType> VERIFY_KINDS = EnumSet.of(ASSERT, PROPERTY, INVARIANT, POSTCONDITION, TEST);

    private static final Set<TokenType> PRIMITIVES = EnumSet.of(
        INT, INT8, INT16, INT32, INT64, UINT, UINT8, UINT16, UINT32, UINT64,
        FLOAT32, FLOAT64, BOOL, STRING, BYTES, VOID);
    private static final Set<TokenType> COMPARISONS = EnumSet.of(EQ, NEQ, LT, GT, LTE, GTE, IN, MATCH);
    private static final Set<TokenType> BUILTINS = EnumSet.of(LEN, CONTAINS, RANGE, NOW, SUM, COUNT);

    private final List<Token> tokens;
    private final ParseOptions options;
    private int pos;
    private int depth;

    public Parser(List<Token> tokens) {
        this(tokens, new ParseOptions());
    }

    public Parser(List<Token> tokens, ParseOptions options) {
        List<Token> filtered = Lexer.withoutNewlines(tokens);
        if (filtered.isEmpty() || !filtered.get(filtered.size() - 1).is(EOF)) {
            int line = filtered.isEmpty() ? 1 : filtered.get(filtered.size() - 1).line();
            filtered.add(new Token(EOF, "", line, 1));
        }
        this.tokens = filtered;
        this.options = options;
    }

    public static Document parse(String src) {
        return parse(src, new ParseOptions());
    }

    public static Document parse(String src, ParseOptions options) {
        return new Parser(Lexer.tokenize(src), options).parseDocument();
    }

    /** Parses a single expression; the whole input must be consumed. */
    public static Expr parseExpression(String src) {
        Parser p = new Parser(Lexer.tokenize(src));
        Expr e = p.expression();
        p.expect(EOF);
        return e;
    }

    public Document parseDocument() {
        Block.Unit unit = unitBlock();
        Block.Meta meta = metaBlock();
        Block.Input input = inputBlock();
        Block.Output output = outputBlock();
        Block.Intent intent = intentBlock();
        Block.Constraint constraint = constraintBlock();
        Block.Flow flow = flowBlock();
        Block.Execution execution = executionBlock();
        Block.Verify verify = verifyBlock();

        if (options.requireEnd) {
            expect(END);
        } else if (match(END)) {
            advance();
        }
        expect(EOF);

        logger.debug("Parsed {} from {} tokens", unit.id().fullName(), tokens.size());
        return new Document(unit, meta, input, output, intent, constraint, flow, execution, verify,
            unit.line(), unit.column());
    }

    // --- blocks ---

    private Block.Unit unitBlock() {
        Token start = expect(UNIT);
        Block.UnitKind kind = Block.UnitKind.valueOf(expect(UNIT_KINDS).type().name());
        Expr.QualifiedName id = qualifiedName();
        String version = null;
        if (match(VERSION)) version = advance().value();
        return new Block.Unit(kind, id, version, start.line(), start.column());
    }

    private Block.Meta metaBlock() {
        Token start = expect(META);
        List<Entry.MetaEntry> entries = new ArrayList<>();
        while (!match(ENDMETA)) entries.add(metaEntry());
        expect(ENDMETA);
        return new Block.Meta(entries, start.line(), start.column());
    }

    private Entry.MetaEntry metaEntry() {
        Token key = expect(META_KEYS);
        Object value;
        Token t = current();
        if (t.is(BOOLEAN)) {
            value = Boolean.parseBoolean(advance().value());
        } else if (t.is(IDENTIFIER)) {
            value = qualifiedName().fullName();
        } else if (t.is(EOF) || t.is(UNKNOWN)) {
            throw unexpected("META value", t);
        } else {
            value = advance().value();
        }
        return new Entry.MetaEntry(key.value(), value, key.line(), key.column());
    }

    private Block.Input inputBlock() {
        Token start = expect(INPUT);
        List<Entry.Field> fields = new ArrayList<>();
        while (!match(ENDINPUT)) fields.add(field());
        expect(ENDINPUT);
        return new Block.Input(fields, start.line(), start.column());
    }

    private Block.Output outputBlock() {
        Token start = expect(OUTPUT);
        List<Entry.Field> fields = new ArrayList<>();
        while (!match(ENDOUTPUT)) fields.add(field());
        expect(ENDOUTPUT);
        return new Block.Output(fields, start.line(), start.column());
    }

    private Entry.Field field() {
        Token name = expect(IDENTIFIER);
        expect(COLON);
        TypeNode type = type();
        List<Expr> constraints = new ArrayList<>();
        if (match(LBRACKET)) {
            advance();
            while (!match(RBRACKET)) {
                constraints.add(expression());
                if (match(COMMA)) advance();
            }
            expect(RBRACKET);
        }
        return new Entry.Field(name.value(), type, constraints, name.line(), name.column());
    }

    private Block.Intent intentBlock() {
        Token start = expect(INTENT);
        expect(GOAL);
        Token goalTok = expect(GOALS);
        Block.Goal goal = Block.Goal.valueOf(goalTok.type().name());
        expect(COLON);

        List<Expr> inputs = new ArrayList<>();
        inputs.add(expression());
        while (match(COMMA)) {
            advance();
            if (match(ARROW)) break;
            inputs.add(expression());
        }
        expect(ARROW);
        List<Expr> outputs = new ArrayList<>();
        outputs.add(expression());
        while (match(COMMA)) {
            advance();
            outputs.add(expression());
        }
        Entry.GoalSpec spec = new Entry.GoalSpec(inputs, outputs, goalTok.line(), goalTok.column());

        List<Block.Priority> priorities = new ArrayList<>();
        if (match(PRIORITY)) {
            advance();
            priorities.add(Block.Priority.valueOf(expect(PRIORITIES).type().name()));
            while (match(GT)) {
                advance();
                priorities.add(Block.Priority.valueOf(expect(PRIORITIES).type().name()));
            }
        }

        Block.FailureStrategy onFailure = null;
        Expr fallback = null;
        if (match(ON_FAILURE)) {
            advance();
            onFailure = Block.FailureStrategy.valueOf(expect(STRATEGIES).type().name());
            if (onFailure == Block.FailureStrategy.FALLBACK || onFailure == Block.FailureStrategy.DEFAULT) {
                fallback = expression();
            }
        }

        expect(ENDINTENT);
        return new Block.Intent(goal, spec, priorities, onFailure, fallback, start.line(), start.column());
    }

    private Block.Constraint constraintBlock() {
        Token start = expect(CONSTRAINT);
        List<Entry.ConstraintEntry> entries = new ArrayList<>();
        while (!match(ENDCONSTRAINT)) {
            Token t = current();
            if (t.is(REQUIRE) && peek(1).is(WITHIN)) {
                advance();
                advance();
                Token d = expect(NUMBER, FLOAT);
                Expr.Literal duration = new Expr.Literal(Expr.Literal.Kind.DURATION, d.value(), d.value(),
                    d.line(), d.column());
                entries.add(new Entry.ConstraintEntry(Entry.ConstraintKind.REQUIRE, duration, t.line(), t.column()));
            } else if (CONSTRAINT_KINDS.contains(t.type())) {
                advance();
                Entry.ConstraintKind kind = Entry.ConstraintKind.valueOf(t.type().name());
                entries.add(new Entry.ConstraintEntry(kind, expression(), t.line(), t.column()));
            } else {
                skipUnrecognized(ENDCONSTRAINT);
            }
        }
        expect(ENDCONSTRAINT);
        return new Block.Constraint(entries, start.line(), start.column());
    }

    private Block.Flow flowBlock() {
        Token start = expect(FLOW);
        List<Entry.FlowNode> nodes = new ArrayList<>();
        List<Entry.FlowEdge> edges = new ArrayList<>();
        while (!match(ENDFLOW)) {
            if (match(NODE)) {
                nodes.add(flowNode());
            } else if (match(EDGE)) {
                edges.add(flowEdge());
            } else {
                skipUnrecognized(ENDFLOW);
            }
        }
        expect(ENDFLOW);
        return new Block.Flow(nodes, edges, start.line(), start.column());
    }

    private Entry.FlowNode flowNode() {
        Token start = expect(NODE);
        String id = expect(IDENTIFIER).value();
        expect(COLON);

        Entry.Op op;
        String customOp = null;
        if (match(EXTERNAL_REF)) {
            customOp = advance().value();
            op = Entry.Op.CALL;
        } else {
            op = Entry.Op.valueOf(expect(OPS).type().name());
        }

        List<Entry.Param> params = new ArrayList<>();
        if (match(LPAREN)) {
            advance();
            while (!match(RPAREN)) {
                Token name = expect(IDENTIFIER);
                expect(ASSIGN);
                params.add(new Entry.Param(name.value(), expression(), name.line(), name.column()));
                if (match(COMMA)) advance();
            }
            expect(RPAREN);
        }
        return new Entry.FlowNode(id, op, params, customOp, start.line(), start.column());
    }

    private Entry.FlowEdge flowEdge() {
        Token start = expect(EDGE);
        Expr source = expression();
        expect(ARROW);
        Expr target = expression();
        Expr condition = null;
        if (match(WHEN)) {
            advance();
            condition = expression();
        }
        return new Entry.FlowEdge(source, target, condition, start.line(), start.column());
    }

    private Block.Execution executionBlock() {
        Token start = expect(EXECUTION);
        boolean parallel = false;
        Block.Target target = Block.Target.ANY;
        Block.Memory memory = Block.Memory.UNBOUNDED;
        String memoryLimit = null;
        Block.Isolation isolation = Block.Isolation.NONE;
        Block.Cache cache = Block.Cache.NONE;
        Long cacheSize = null;

        while (!match(ENDEXECUTION)) {
            Token t = current();
            switch (t.type()) {
                case PARALLEL -> {
                    advance();
                    parallel = Boolean.parseBoolean(expect(BOOLEAN).value());
                }
                case TARGET -> {
                    advance();
                    target = Block.Target.valueOf(expect(TARGETS).type().name());
                }
                case MEMORY -> {
                    advance();
                    memory = Block.Memory.valueOf(expect(MEMORY_POLICIES).type().name());
                    if (memory == Block.Memory.BOUNDED && match(NUMBER, FLOAT)) {
                        memoryLimit = advance().value();
                    }
                }
                case ISOLATION -> {
                    advance();
                    isolation = Block.Isolation.valueOf(expect(ISOLATIONS).type().name());
                }
                case CACHE -> {
                    advance();
                    cache = Block.Cache.valueOf(expect(CACHES).type().name());
                    if (cache != Block.Cache.NONE && match(NUMBER)) {
                        Token size = advance();
                        cacheSize = (Long) numberLiteral(size).value();
                    }
                }
                default -> skipUnrecognized(ENDEXECUTION);
            }
        }
        expect(ENDEXECUTION);
        return new Block.Execution(parallel, target, memory, memoryLimit, isolation, cache, cacheSize,
            start.line(), start.column());
    }

    private Block.Verify verifyBlock() {
        Token start = expect(VERIFY);
        List<Entry.VerifyEntry> entries = new ArrayList<>();
        while (!match(ENDVERIFY)) {
            Token t = current();
            if (!VERIFY_KINDS.contains(t.type())) {
                skipUnrecognized(ENDVERIFY);
                continue;
            }
            advance();
            Entry.VerifyKind kind = Entry.VerifyKind.valueOf(t.type().name());
            if (kind == Entry.VerifyKind.TEST) {
                String ref = expect(EXTERNAL_REF).value();
                entries.add(new Entry.VerifyEntry(kind, null, ref, t.line(), t.column()));
            } else {
                entries.add(new Entry.VerifyEntry(kind, expression(), null, t.line(), t.column()));
            }
        }
        expect(ENDVERIFY);
        return new Block.Verify(entries, start.line(), start.column());
    }

    // --- types ---

    private TypeNode type() {
        Token t = current();
        if (PRIMITIVES.contains(t.type())) {
            advance();
            return new TypeNode.Primitive(t.value(), t.line(), t.column());
        }
        switch (t.type()) {
            case EXTERNAL_REF -> {
                advance();
                return new TypeNode.Ref(t.value(), t.line(), t.column());
            }
            case ARRAY, OPTIONAL, MAP, UNION, STRUCT -> {
                enter(t);
                try {
                    return compositeType(t);
                } finally {
                    depth--;
                }
            }
            default -> throw unexpected("type", t);
        }
    }

    private TypeNode compositeType(Token t) {
        advance();
        switch (t.type()) {
            case ARRAY -> {
                expect(LT);
                TypeNode element = type();
                expect(GT);
                return new TypeNode.ArrayOf(element, t.line(), t.column());
            }
            case OPTIONAL -> {
                expect(LT);
                TypeNode inner = type();
                expect(GT);
                return new TypeNode.OptionalOf(inner, t.line(), t.column());
            }
            case MAP -> {
                expect(LT);
                TypeNode key = type();
                expect(COMMA);
                TypeNode value = type();
                expect(GT);
                return new TypeNode.MapOf(key, value, t.line(), t.column());
            }
            case UNION -> {
                expect(LT);
                List<TypeNode> alternatives = new ArrayList<>();
                alternatives.add(type());
                while (match(PIPE)) {
                    advance();
                    alternatives.add(type());
                }
                expect(GT);
                return new TypeNode.UnionOf(alternatives, t.line(), t.column());
            }
            default -> {
                expect(LBRACE);
                List<TypeNode.Member> members = new ArrayList<>();
                while (!match(RBRACE)) {
                    String name = expect(IDENTIFIER).value();
                    expect(COLON);
                    members.add(new TypeNode.Member(name, type()));
                    if (match(COMMA)) advance();
                }
                expect(RBRACE);
                return new TypeNode.Struct(members, t.line(), t.column());
            }
        }
    }

    // --- expressions, lowest precedence first ---

    Expr expression() {
        return or();
    }

    private Expr or() {
        Expr left = and();
        while (match(OR)) {
            String op = advance().value();
            left = new Expr.Binary(left, op, and(), left.line(), left.column());
        }
        return left;
    }

    private Expr and() {
        Expr left = comparison();
        while (match(AND)) {
            String op = advance().value();
            left = new Expr.Binary(left, op, comparison(), left.line(), left.column());
        }
        return left;
    }

    private Expr comparison() {
        Expr left = additive();
        while (COMPARISONS.contains(current().type())) {
            String op = advance().value();
            left = new Expr.Binary(left, op, additive(), left.line(), left.column());
        }
        return left;
    }

    private Expr additive() {
        Expr left = multiplicative();
        while (match(PLUS, MINUS)) {
            String op = advance().value();
            left = new Expr.Binary(left, op, multiplicative(), left.line(), left.column());
        }
        return left;
    }

    private Expr multiplicative() {
        Expr left = unary();
        while (match(STAR, SLASH)) {
            String op = advance().value();
            left = new Expr.Binary(left, op, unary(), left.line(), left.column());
        }
        return left;
    }

    private Expr unary() {
        if (!match(NOT, MINUS)) return primary();
        Token op = advance();
        enter(op);
        try {
            return new Expr.Unary(op.value(), unary(), op.line(), op.column());
        } finally {
            depth--;
        }
    }

    private Expr primary() {
        Token t = current();
        switch (t.type()) {
            case LPAREN -> {
                advance();
                enter(t);
                try {
                    Expr inner = expression();
                    expect(RPAREN);
                    return inner;
                } finally {
                    depth--;
                }
            }
            case NUMBER -> {
                advance();
                return numberLiteral(t);
            }
            case FLOAT -> {
                advance();
                return floatLiteral(t);
            }
            case STRING_LITERAL -> {
                advance();
                return new Expr.Literal(Expr.Literal.Kind.STRING, t.value(), t.value(), t.line(), t.column());
            }
            case BOOLEAN -> {
                advance();
                return new Expr.Literal(Expr.Literal.Kind.BOOL, Boolean.parseBoolean(t.value()), t.value(),
                    t.line(), t.column());
            }
            case REGEX -> {
                advance();
                return new Expr.Literal(Expr.Literal.Kind.REGEX, t.value(), t.value(), t.line(), t.column());
            }
            case VOID -> {
                advance();
                return new Expr.Literal(Expr.Literal.Kind.VOID, null, t.value(), t.line(), t.column());
            }
            case EXTERNAL_REF -> {
                advance();
                return new Expr.ExternalRef(t.value(), t.line(), t.column());
            }
            case LEN, CONTAINS, RANGE, NOW, SUM, COUNT -> {
                return builtin();
            }
            case IDENTIFIER -> {
                return identifierChain();
            }
            case INPUT, OUTPUT -> {
                advance();
                Expr base = new Expr.Identifier(t.value(), t.line(), t.column());
                if (!match(DOT)) return base;
                advance();
                String field = expect(IDENTIFIER).value();
                return new Expr.FieldAccess(base, field, t.line(), t.column());
            }
            default -> throw unexpected("expression", t);
        }
    }

    private Expr builtin() {
        Token name = advance();
        if (!match(LPAREN)) return new Expr.Identifier(name.value(), name.line(), name.column());
        advance();
        enter(name);
        try {
            List<Expr> args = new ArrayList<>();
            if (!match(RPAREN)) {
                args.add(expression());
                while (match(COMMA)) {
                    advance();
                    args.add(expression());
                }
            }
            expect(RPAREN);
            return new Expr.Call(name.value(), args, name.line(), name.column());
        } finally {
            depth--;
        }
    }

    private Expr identifierChain() {
        Token first = expect(IDENTIFIER);
        Expr expr = new Expr.Identifier(first.value(), first.line(), first.column());
        while (true) {
            if (match(DOT)) {
                advance();
                String field = expect(IDENTIFIER).value();
                expr = new Expr.FieldAccess(expr, field, first.line(), first.column());
            } else if (match(LBRACKET)) {
                Token open = advance();
                enter(open);
                try {
                    Expr index = expression();
                    expect(RBRACKET);
                    expr = new Expr.Index(expr, index, first.line(), first.column());
                } finally {
                    depth--;
                }
            } else {
                return expr;
            }
        }
    }

    private Expr.QualifiedName qualifiedName() {
        Token first = expect(IDENTIFIER);
        List<String> parts = new ArrayList<>();
        parts.add(first.value());
        while (match(DOT)) {
            advance();
            parts.add(expect(IDENTIFIER).value());
        }
        return new Expr.QualifiedName(parts, first.line(), first.column());
    }

    private Expr.Literal numberLiteral(Token t) {
        try {
            long value = Long.parseLong(stripUnit(t.value()));
            return new Expr.Literal(Expr.Literal.Kind.NUMBER, value, t.value(), t.line(), t.column());
        } catch (NumberFormatException e) {
            throw new ParseException("Invalid numeric literal '" + t.value() + "'", t);
        }
    }

    private Expr.Literal floatLiteral(Token t) {
        try {
            double value = Double.parseDouble(stripUnit(t.value()));
            return new Expr.Literal(Expr.Literal.Kind.FLOAT, value, t.value(), t.line(), t.column());
        } catch (NumberFormatException e) {
            throw new ParseException("Invalid numeric literal '" + t.value() + "'", t);
        }
    }

    /** Drops a trailing duration or size suffix such as {@code ms} or {@code MB}. */
    static String stripUnit(String text) {
        int end = text.length();
        while (end > 0 && "smhKMGB".indexOf(text.charAt(end - 1)) >= 0) end--;
        return text.substring(0, end);
    }

    // --- token stream ---

    private Token current() {
        return tokens.get(pos);
    }

    private Token peek(int offset) {
        int i = pos + offset;
        return i < tokens.size() ? tokens.get(i) : tokens.get(tokens.size() - 1);
    }

    private Token advance() {
        Token t = current();
        if (pos < tokens.size() - 1) pos++;
        return t;
    }

    private boolean match(TokenType... types) {
        TokenType actual = current().type();
        for (TokenType t : types) {
            if (t == actual) return true;
        }
        return false;
    }

    private Token expect(TokenType... types) {
        if (match(types)) return advance();
        String expected = Arrays.stream(types).map(Enum::name).collect(Collectors.joining(" or "));
        throw mismatch(expected);
    }

    private Token expect(Set<TokenType> types) {
        if (types.contains(current().type())) return advance();
        String expected = types.stream().map(Enum::name).collect(Collectors.joining(" or "));
        throw mismatch(expected);
    }

    private ParseException mismatch(String expected) {
        Token t = current();
        return new ParseException("Expected " + expected + ", got " + t.type() + " '" + t.value() + "'", t);
    }

    private static ParseException unexpected(String what, Token t) {
        return new ParseException("Expected " + what + ", got " + t.type() + " '" + t.value() + "'", t);
    }

    /** Lenient blocks step over stray tokens but never past EOF or an UNKNOWN character. */
    private void skipUnrecognized(TokenType end) {
        Token t = current();
        if (t.is(EOF)) {
            throw new ParseException("Unterminated block, expected " + end, t);
        }
        if (t.is(UNKNOWN)) {
            throw new ParseException("Unexpected character '" + t.value() + "'", t);
        }
        logger.trace("Skipping {} at L{}:C{}", t.type(), t.line(), t.column());
        advance();
    }

    private void enter(Token t) {
        if (++depth > options.maxDepth) {
            depth--;
            throw new ParseException("Maximum nesting depth " + options.maxDepth + " exceeded", t);
        }
    }
}
