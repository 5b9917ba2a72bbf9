package io.vais.lang;

import java.util.List;

/**
 * Expression nodes.
 */
public sealed interface Expr extends Node {

    record Literal(Kind kind, Object value, String text, int line, int column) implements Expr {
        /**
         * Value classes: NUMBER is a Long, FLOAT a Double, BOOL a Boolean,
         * STRING/REGEX/DURATION a String, VOID null. {@code text} keeps the
         * source spelling including unit suffixes.
         */
        public enum Kind { NUMBER, FLOAT, STRING, BOOL, REGEX, VOID, DURATION }

        public <R> R accept(NodeVisitor<R> v) { return v.visitLiteral(this); }
    }

    record Identifier(String name, int line, int column) implements Expr {
        public <R> R accept(NodeVisitor<R> v) { return v.visitIdentifier(this); }
    }

    record QualifiedName(List<String> parts, int line, int column) implements Expr {
        public QualifiedName {
            parts = List.copyOf(parts);
        }

        public String fullName() {
            return String.join(".", parts);
        }

        public <R> R accept(NodeVisitor<R> v) { return v.visitQualifiedName(this); }
    }

    record ExternalRef(String ref, int line, int column) implements Expr {
        public <R> R accept(NodeVisitor<R> v) { return v.visitExternalRef(this); }
    }

    /** {@code a.b.c} is FieldAccess(FieldAccess(Identifier(a), b), c). */
    record FieldAccess(Expr base, String field, int line, int column) implements Expr {
        public <R> R accept(NodeVisitor<R> v) { return v.visitFieldAccess(this); }
    }

    record Binary(Expr left, String operator, Expr right, int line, int column) implements Expr {
        public <R> R accept(NodeVisitor<R> v) { return v.visitBinary(this); }
    }

    record Unary(String operator, Expr operand, int line, int column) implements Expr {
        public <R> R accept(NodeVisitor<R> v) { return v.visitUnary(this); }
    }

    record Call(String name, List<Expr> arguments, int line, int column) implements Expr {
        public Call {
            arguments = List.copyOf(arguments);
        }

        public <R> R accept(NodeVisitor<R> v) { return v.visitCall(this); }
    }

    record Index(Expr base, Expr index, int line, int column) implements Expr {
        public <R> R accept(NodeVisitor<R> v) { return v.visitIndex(this); }
    }
}
