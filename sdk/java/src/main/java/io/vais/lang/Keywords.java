package io.vais.lang;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Process-wide keyword table. Built once, never mutated.
 */
final class Keywords {
    private Keywords() {}

    /** Keyword token kinds that are spelled exactly like their enum name. */
    private static final Set<TokenType> SPELLED_AS_NAMED = EnumSet.range(TokenType.UNIT, TokenType.COUNT);

    /** Logical words also accepted in lower case. */
    private static final Set<TokenType> CASE_FOLDED = EnumSet.of(
        TokenType.AND, TokenType.OR, TokenType.XOR, TokenType.NOT,
        TokenType.IMPLIES, TokenType.IN, TokenType.MATCH
    );

    private static final Map<String, TokenType> TABLE = build();

    private static Map<String, TokenType> build() {
        Map<String, TokenType> table = new HashMap<>();
        for (TokenType t : SPELLED_AS_NAMED) {
            table.put(t.name(), t);
        }
        for (TokenType t : CASE_FOLDED) {
            table.put(t.name().toLowerCase(), t);
        }
        table.put("true", TokenType.BOOLEAN);
        table.put("false", TokenType.BOOLEAN);
        return Map.copyOf(table);
    }

    /** Returns the keyword kind for {@code word}, or IDENTIFIER. */
    static TokenType lookup(String word) {
        return TABLE.getOrDefault(word, TokenType.IDENTIFIER);
    }

    static boolean isKeyword(String word) {
        return TABLE.containsKey(word);
    }
}
