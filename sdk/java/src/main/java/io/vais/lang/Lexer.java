package io.vais.lang;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns source text into tokens. Total: malformed input yields UNKNOWN
 * tokens, never an exception, and the result always ends with one EOF token.
 * Unterminated string and regex literals are closed at end of input.
 */
public final class Lexer {
    private static final Logger logger = LoggerFactory.getLogger(Lexer.class);

    private static final Map<Character, TokenType> SINGLE_CHAR = Map.ofEntries(
        Map.entry(':', TokenType.COLON),
        Map.entry(',', TokenType.COMMA),
        Map.entry('.', TokenType.DOT),
        Map.entry('>', TokenType.GT),
        Map.entry('<', TokenType.LT),
        Map.entry('=', TokenType.ASSIGN),
        Map.entry('(', TokenType.LPAREN),
        Map.entry(')', TokenType.RPAREN),
        Map.entry('[', TokenType.LBRACKET),
        Map.entry(']', TokenType.RBRACKET),
        Map.entry('{', TokenType.LBRACE),
        Map.entry('}', TokenType.RBRACE),
        Map.entry('|', TokenType.PIPE),
        Map.entry('+', TokenType.PLUS),
        Map.entry('-', TokenType.MINUS),
        Map.entry('*', TokenType.STAR),
        Map.entry('/', TokenType.SLASH)
    );

    private static final Map<String, TokenType> TWO_CHAR = Map.of(
        "->", TokenType.ARROW,
        ">=", TokenType.GTE,
        "<=", TokenType.LTE,
        "==", TokenType.EQ,
        "!=", TokenType.NEQ
    );

    private static final char EOF_CHAR = '\0';

    private final String src;
    private int pos;
    private int line = 1;
    private int column = 1;
    private final List<Token> tokens = new ArrayList<>();

    public Lexer(String source) {
        this.src = source;
    }

    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    /** The same tokens with every NEWLINE removed. */
    public static List<Token> withoutNewlines(List<Token> tokens) {
        List<Token> out = new ArrayList<>(tokens.size());
        for (Token t : tokens) {
            if (t.type() != TokenType.NEWLINE) out.add(t);
        }
        return out;
    }

    public List<Token> tokenize() {
        while (pos < src.length()) {
            skipWhitespace();
            skipComment();
            if (pos >= src.length()) break;

            char ch = peek(0);
            int startLine = line;
            int startColumn = column;

            if (ch == '\n') {
                advance();
                add(TokenType.NEWLINE, "\n", startLine, startColumn);
            } else if (ch == '"' || ch == '\'') {
                readString();
            } else if (ch == '/' && startsRegex()) {
                readRegex();
            } else if (isDigit(ch) || (ch == '-' && isDigit(peek(1)))) {
                readNumber();
            } else if (ch == '@') {
                readExternalRef();
            } else if (isIdentStart(ch)) {
                readIdentifier();
            } else {
                readOperator(ch, startLine, startColumn);
            }
        }
        add(TokenType.EOF, "", line, column);
        logger.debug("Tokenized {} characters into {} tokens", src.length(), tokens.size());
        return tokens;
    }

    private void readOperator(char ch, int startLine, int startColumn) {
        if (pos + 1 < src.length()) {
            String two = src.substring(pos, pos + 2);
            TokenType type = TWO_CHAR.get(two);
            if (type != null) {
                advance();
                advance();
                add(type, two, startLine, startColumn);
                return;
            }
        }
        advance();
        TokenType single = SINGLE_CHAR.get(ch);
        if (single != null) {
            add(single, String.valueOf(ch), startLine, startColumn);
        } else {
            logger.trace("Unknown character '{}' at L{}:C{}", ch, startLine, startColumn);
            add(TokenType.UNKNOWN, String.valueOf(ch), startLine, startColumn);
        }
    }

    private void readString() {
        int startLine = line;
        int startColumn = column;
        char quote = advance();
        StringBuilder value = new StringBuilder();

        while (pos < src.length() && peek(0) != quote) {
            char ch = advance();
            if (ch != '\\') {
                value.append(ch);
                continue;
            }
            if (pos >= src.length()) break;
            char escaped = advance();
            switch (escaped) {
                case 'n' -> value.append('\n');
                case 't' -> value.append('\t');
                default -> value.append(escaped);
            }
        }
        if (pos < src.length()) advance();
        add(TokenType.STRING_LITERAL, value.toString(), startLine, startColumn);
    }

    private boolean startsRegex() {
        char next = peek(1);
        return next != EOF_CHAR && next != ' ' && next != '\t' && next != '\n';
    }

    private void readRegex() {
        int startLine = line;
        int startColumn = column;
        advance();
        StringBuilder value = new StringBuilder();

        while (pos < src.length() && peek(0) != '/') {
            if (peek(0) == '\\') {
                value.append(advance());
                if (pos >= src.length()) break;
            }
            value.append(advance());
        }
        if (pos < src.length()) advance();
        add(TokenType.REGEX, value.toString(), startLine, startColumn);
    }

    private void readNumber() {
        int startLine = line;
        int startColumn = column;
        StringBuilder value = new StringBuilder();
        boolean isFloat = false;

        if (peek(0) == '-') value.append(advance());

        while (isDigit(peek(0)) || peek(0) == '.') {
            if (peek(0) == '.') {
                if (isFloat) break;
                isFloat = true;
            }
            value.append(advance());
        }

        // duration suffix
        if (peek(0) == 'm' && peek(1) == 's') {
            value.append(advance()).append(advance());
        } else if (peek(0) == 's' || peek(0) == 'm' || peek(0) == 'h') {
            value.append(advance());
        }

        // size suffix
        if (peek(0) == 'K' || peek(0) == 'M' || peek(0) == 'G') {
            value.append(advance());
            if (peek(0) == 'B') value.append(advance());
        }

        add(isFloat ? TokenType.FLOAT : TokenType.NUMBER, value.toString(), startLine, startColumn);
    }

    private void readIdentifier() {
        int startLine = line;
        int startColumn = column;
        StringBuilder value = new StringBuilder();

        while (isIdentPart(peek(0))) value.append(advance());

        if (value.length() > 1 && value.charAt(0) == 'V' && isDigit(value.charAt(1))) {
            while (isDigit(peek(0)) || peek(0) == '.') value.append(advance());
            add(TokenType.VERSION, value.toString(), startLine, startColumn);
            return;
        }

        String word = value.toString();
        add(Keywords.lookup(word), word, startLine, startColumn);
    }

    private void readExternalRef() {
        int startLine = line;
        int startColumn = column;
        StringBuilder value = new StringBuilder();
        value.append(advance());

        while (isIdentPart(peek(0)) || peek(0) == '.') value.append(advance());

        add(TokenType.EXTERNAL_REF, value.toString(), startLine, startColumn);
    }

    private void skipWhitespace() {
        while (peek(0) == ' ' || peek(0) == '\t' || peek(0) == '\r') advance();
    }

    private void skipComment() {
        if (peek(0) != '#') return;
        while (pos < src.length() && peek(0) != '\n') advance();
    }

    private char peek(int offset) {
        int i = pos + offset;
        return i < src.length() ? src.charAt(i) : EOF_CHAR;
    }

    private char advance() {
        char ch = src.charAt(pos++);
        if (ch == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return ch;
    }

    private void add(TokenType type, String value, int tokLine, int tokColumn) {
        tokens.add(new Token(type, value, tokLine, tokColumn));
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isIdentStart(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
    }

    private static boolean isIdentPart(char ch) {
        return isIdentStart(ch) || isDigit(ch);
    }
}
