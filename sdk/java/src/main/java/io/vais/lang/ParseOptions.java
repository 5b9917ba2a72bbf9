package io.vais.lang;

/**
 * Parser settings.
 */
public class ParseOptions {
    /** Maximum nesting of parenthesised/unary expressions, builtin calls, index brackets and composite types. */
    public int maxDepth = 256;
    /** When false, the closing END keyword may be omitted. */
    public boolean requireEnd = true;
}
