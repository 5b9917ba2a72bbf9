package io.vais.lang;

/**
 * A lexical token. {@code value} holds the literal text, except for string
 * literals where it holds the unescaped contents and regex literals where it
 * holds the body between the slashes.
 */
public record Token(TokenType type, String value, int line, int column) {

    public boolean is(TokenType t) {
        return type == t;
    }

    @Override
    public String toString() {
        return "Token(" + type + ", '" + value + "', L" + line + ":C" + column + ")";
    }
}
