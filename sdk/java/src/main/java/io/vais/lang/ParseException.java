package io.vais.lang;

/**
 * Raised on the first ungrammatical construct. Carries the position of the
 * offending token; there is no partial tree.
 */
public class ParseException extends VaisException {
    private final String reason;
    private final int line;
    private final int column;
    private final Token token;

    public ParseException(String reason, int line, int column, Token token) {
        super("ParseError at L" + line + ":C" + column + ": " + reason);
        this.reason = reason;
        this.line = line;
        this.column = column;
        this.token = token;
    }

    public ParseException(String reason, Token token) {
        this(reason, token.line(), token.column(), token);
    }

    /** The message without the position prefix. */
    public String reason() { return reason; }

    public int line() { return line; }

    public int column() { return column; }

    /** May be null when the error was not caused by a specific token. */
    public Token token() { return token; }
}
