package io.vais.lang;

/**
 * Closed set of token kinds produced by the {@link Lexer}.
 */
public enum TokenType {
    // block keywords
    UNIT, META, ENDMETA, INPUT, ENDINPUT, OUTPUT, ENDOUTPUT,
    INTENT, ENDINTENT, CONSTRAINT, ENDCONSTRAINT, FLOW, ENDFLOW,
    EXECUTION, ENDEXECUTION, VERIFY, ENDVERIFY, END,

    // unit kinds
    FUNCTION, SERVICE, PIPELINE, MODULE,

    // META keys
    DOMAIN, DETERMINISM, IDEMPOTENT, PURE, TIMEOUT, RETRY,

    // INTENT
    GOAL, PRIORITY, ON_FAILURE,
    TRANSFORM, VALIDATE, AGGREGATE, FILTER, ROUTE, COMPOSE, FETCH,
    CORRECTNESS, PERFORMANCE, MEMORY, LATENCY, THROUGHPUT,
    ABORT, FALLBACK, DEFAULT,

    // CONSTRAINT
    REQUIRE, FORBID, PREFER, INVARIANT, WITHIN,

    // FLOW
    NODE, EDGE, WHEN,
    MAP, REDUCE, SPLIT, MERGE, BRANCH, JOIN, RACE, STORE, CALL, EMIT,
    SUBSCRIBE, SANITIZE, AUTHORIZE,

    // EXECUTION
    PARALLEL, TARGET, ISOLATION, CACHE,
    ANY, CPU, GPU, WASM, NATIVE,
    BOUNDED, UNBOUNDED, STACK_ONLY,
    NONE, THREAD, PROCESS, CONTAINER,
    LRU, TTL,

    // VERIFY
    ASSERT, PROPERTY, POSTCONDITION, TEST,
    FORALL, EXISTS, EVENTUALLY, ALWAYS,

    // types
    INT, INT8, INT16, INT32, INT64,
    UINT, UINT8, UINT16, UINT32, UINT64,
    FLOAT32, FLOAT64, BOOL, STRING, BYTES, VOID,
    ARRAY, STRUCT, OPTIONAL, UNION,

    // logical words and builtins
    AND, OR, XOR, NOT, IMPLIES, IN, MATCH,
    LEN, CONTAINS, RANGE, NOW, SUM, COUNT,

    // literals
    NUMBER, FLOAT, STRING_LITERAL, BOOLEAN, REGEX,

    IDENTIFIER,
    /** Starts with {@code @}. */
    EXTERNAL_REF,
    /** {@code V1.0.0} */
    VERSION,

    // punctuation
    COLON, COMMA, DOT, ARROW, GT, LT, GTE, LTE, EQ, NEQ, ASSIGN,
    LPAREN, RPAREN, LBRACKET, RBRACKET, LBRACE, RBRACE, PIPE,
    PLUS, MINUS, STAR, SLASH,

    NEWLINE,
    EOF,
    UNKNOWN
}
