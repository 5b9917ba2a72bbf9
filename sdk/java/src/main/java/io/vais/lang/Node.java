package io.vais.lang;

/**
 * Root of the AST. The variant set is closed and nodes are immutable once the
 * parser builds them. Positions point at the node's first token; a binary
 * node takes its left operand's position, so an enclosing {@code (} is not
 * counted.
 */
public sealed interface Node permits Document, Block, Entry, TypeNode, Expr {
    int line();

    int column();

    <R> R accept(NodeVisitor<R> visitor);
}
