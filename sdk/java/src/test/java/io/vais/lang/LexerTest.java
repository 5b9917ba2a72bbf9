package io.vais.lang;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

class LexerTest {

    static List<TokenType> types(String src) {
        return Lexer.tokenize(src).stream().map(Token::type).collect(Collectors.toList());
    }

    static Token first(String src) {
        return Lexer.tokenize(src).get(0);
    }

    // --- Structure ---

    @Test void emptySourceYieldsOnlyEof() {
        assertEquals(List.of(TokenType.EOF), types(""));
    }

    @Test void keywordsAndIdentifiers() {
        assertEquals(List.of(TokenType.UNIT, TokenType.FUNCTION, TokenType.IDENTIFIER, TokenType.DOT,
            TokenType.IDENTIFIER, TokenType.EOF), types("UNIT FUNCTION examples.add"));
    }

    @Test void keywordsAreCaseSensitive() {
        assertEquals(TokenType.IDENTIFIER, first("input").type());
        assertEquals(TokenType.INPUT, first("INPUT").type());
    }

    @Test void logicalWordsInEitherCase() {
        assertEquals(List.of(TokenType.AND, TokenType.OR, TokenType.NOT, TokenType.IN, TokenType.MATCH,
            TokenType.AND, TokenType.EOF), types("and or not in match AND"));
    }

    @Test void keywordTable() {
        assertTrue(Keywords.isKeyword("ENDFLOW"));
        assertTrue(Keywords.isKeyword("implies"));
        assertFalse(Keywords.isKeyword("input"));
        assertFalse(Keywords.isKeyword("Or"));
    }

    @Test void booleans() {
        assertEquals(TokenType.BOOLEAN, first("true").type());
        assertEquals(TokenType.BOOLEAN, first("false").type());
        assertEquals(TokenType.IDENTIFIER, first("True").type());
    }

    @Test void newlinesKeptAndCommentsDropped() {
        List<Token> tokens = Lexer.tokenize("A # trailing comment\n  B");
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.NEWLINE, TokenType.IDENTIFIER, TokenType.EOF),
            tokens.stream().map(Token::type).collect(Collectors.toList()));
        Token b = tokens.get(2);
        assertEquals(2, b.line());
        assertEquals(3, b.column());
    }

    @Test void withoutNewlinesFilters() {
        List<Token> tokens = Lexer.withoutNewlines(Lexer.tokenize("a\n\nb\n"));
        assertEquals(3, tokens.size());
        assertTrue(tokens.stream().noneMatch(t -> t.is(TokenType.NEWLINE)));
    }

    // --- Versions and references ---

    @Test void version() {
        Token t = first("V1.0.2");
        assertEquals(TokenType.VERSION, t.type());
        assertEquals("V1.0.2", t.value());
    }

    @Test void bareVIsIdentifier() {
        assertEquals(TokenType.IDENTIFIER, first("V").type());
        assertEquals(TokenType.IDENTIFIER, first("Vx1").type());
    }

    @Test void externalRef() {
        Token t = first("@tests.math.add_positive");
        assertEquals(TokenType.EXTERNAL_REF, t.type());
        assertEquals("@tests.math.add_positive", t.value());
        assertEquals(2, Lexer.tokenize("@a.b").size());
    }

    // --- Numbers ---

    @Test void integerAndFloat() {
        assertEquals(TokenType.NUMBER, first("42").type());
        assertEquals(TokenType.FLOAT, first("3.14").type());
    }

    @Test void negativeNumberIsOneToken() {
        Token t = first("-42");
        assertEquals(TokenType.NUMBER, t.type());
        assertEquals("-42", t.value());
    }

    @Test void minusBeforeLetterIsOperator() {
        assertEquals(List.of(TokenType.MINUS, TokenType.IDENTIFIER, TokenType.EOF), types("-x"));
    }

    @Test void durationSuffixes() {
        assertEquals("100ms", first("100ms").value());
        assertEquals("5s", first("5s").value());
        assertEquals("2m", first("2m").value());
        assertEquals("1h", first("1h").value());
    }

    @Test void sizeSuffixes() {
        assertEquals("256MB", first("256MB").value());
        assertEquals("4K", first("4K").value());
        Token t = first("1.5GB");
        assertEquals(TokenType.FLOAT, t.type());
        assertEquals("1.5GB", t.value());
    }

    @Test void secondDotEndsNumber() {
        List<Token> tokens = Lexer.tokenize("1.2.3");
        assertEquals("1.2", tokens.get(0).value());
        assertEquals(TokenType.DOT, tokens.get(1).type());
        assertEquals("3", tokens.get(2).value());
    }

    // --- Strings and regexes ---

    @Test void stringEscapes() {
        Token t = first("\"a\\nb\\t\\\\\\\"q\"");
        assertEquals(TokenType.STRING_LITERAL, t.type());
        assertEquals("a\nb\t\\\"q", t.value());
    }

    @Test void singleQuotedString() {
        assertEquals("it's", first("'it\\'s'").value());
    }

    @Test void unknownEscapeKeptVerbatim() {
        assertEquals("q", first("\"\\q\"").value());
    }

    @Test void unterminatedStringClosesAtEof() {
        List<Token> tokens = Lexer.tokenize("\"abc");
        assertEquals(2, tokens.size());
        assertEquals("abc", tokens.get(0).value());
        assertEquals(TokenType.EOF, tokens.get(1).type());
    }

    @Test void regexLiteral() {
        Token t = first("/ab\\/c/");
        assertEquals(TokenType.REGEX, t.type());
        assertEquals("ab\\/c", t.value());
    }

    @Test void slashFollowedBySpaceIsDivision() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.SLASH, TokenType.IDENTIFIER, TokenType.EOF),
            types("a / b"));
    }

    @Test void unterminatedRegexClosesAtEof() {
        List<Token> tokens = Lexer.tokenize("/abc");
        assertEquals(TokenType.REGEX, tokens.get(0).type());
        assertEquals("abc", tokens.get(0).value());
        assertEquals(2, tokens.size());
    }

    // --- Operators ---

    @Test void twoCharOperators() {
        assertEquals(List.of(TokenType.ARROW, TokenType.GTE, TokenType.LTE, TokenType.EQ, TokenType.NEQ,
            TokenType.EOF), types("-> >= <= == !="));
    }

    @Test void singleCharPunctuation() {
        assertEquals(List.of(TokenType.COLON, TokenType.COMMA, TokenType.DOT, TokenType.GT, TokenType.LT,
            TokenType.ASSIGN, TokenType.LPAREN, TokenType.RPAREN, TokenType.LBRACKET, TokenType.RBRACKET,
            TokenType.LBRACE, TokenType.RBRACE, TokenType.PIPE, TokenType.PLUS, TokenType.STAR, TokenType.EOF),
            types(": , . > < = ( ) [ ] { } | + *"));
    }

    @Test void unknownCharacterIsAToken() {
        List<Token> tokens = Lexer.tokenize("a $ b");
        assertEquals(TokenType.UNKNOWN, tokens.get(1).type());
        assertEquals("$", tokens.get(1).value());
        assertEquals(TokenType.UNKNOWN, first("!").type());
    }

    // --- Totality ---

    @Test void neverThrowsAndEndsWithOneEof() {
        Random rnd = new Random(7);
        String alphabet = "abcV09_.-@#/\\\"'\n\t :,<>=!()[]{}|+*$%^&~`";
        for (int i = 0; i < 500; i++) {
            StringBuilder sb = new StringBuilder();
            int len = rnd.nextInt(40);
            for (int j = 0; j < len; j++) sb.append(alphabet.charAt(rnd.nextInt(alphabet.length())));
            List<Token> tokens = Lexer.tokenize(sb.toString());
            assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).type(), sb.toString());
            assertEquals(1, tokens.stream().filter(t -> t.is(TokenType.EOF)).count(), sb.toString());
        }
    }

    @Test void countsLexicalUnits() {
        List<Token> tokens = Lexer.withoutNewlines(Lexer.tokenize("REQUIRE input.a >= -10 AND LEN(name) <= 5s\n"));
        // REQUIRE input . a >= -10 AND LEN ( name ) <= 5s EOF
        assertEquals(14, tokens.size());
    }
}
