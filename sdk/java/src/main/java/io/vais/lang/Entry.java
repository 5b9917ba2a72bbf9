package io.vais.lang;

import java.util.List;

/**
 * Items that live inside a block.
 */
public sealed interface Entry extends Node {

    /** {@code value} is a Boolean for true/false, otherwise the source text. */
    record MetaEntry(String key, Object value, int line, int column) implements Entry {
        public <R> R accept(NodeVisitor<R> v) { return v.visitMetaEntry(this); }
    }

    /** An INPUT or OUTPUT declaration: {@code name : type [constraints]}. */
    record Field(String name, TypeNode type, List<Expr> constraints, int line, int column) implements Entry {
        public Field {
            constraints = List.copyOf(constraints);
        }

        public <R> R accept(NodeVisitor<R> v) { return v.visitField(this); }
    }

    record GoalSpec(List<Expr> inputs, List<Expr> outputs, int line, int column) implements Entry {
        public GoalSpec {
            inputs = List.copyOf(inputs);
            outputs = List.copyOf(outputs);
        }

        public <R> R accept(NodeVisitor<R> v) { return v.visitGoalSpec(this); }
    }

    enum ConstraintKind { REQUIRE, FORBID, PREFER, INVARIANT }

    /** {@code REQUIRE WITHIN 100ms} is a REQUIRE whose expression is a DURATION literal. */
    record ConstraintEntry(ConstraintKind kind, Expr expression, int line, int column) implements Entry {
        public <R> R accept(NodeVisitor<R> v) { return v.visitConstraintEntry(this); }
    }

    record Param(String name, Expr value, int line, int column) implements Entry {
        public <R> R accept(NodeVisitor<R> v) { return v.visitParam(this); }
    }

    enum Op {
        MAP, FILTER, REDUCE, TRANSFORM,
        BRANCH, MERGE, SPLIT, JOIN, RACE,
        FETCH, STORE, CALL, EMIT, SUBSCRIBE,
        VALIDATE, SANITIZE, AUTHORIZE
    }

    /** A custom operation ({@code @ops.x}) is recorded as CALL with {@code customOp} set. */
    record FlowNode(String id, Op op, List<Param> params, String customOp, int line, int column) implements Entry {
        public FlowNode {
            params = List.copyOf(params);
        }

        public boolean hasParam(String name) {
            for (Param p : params) {
                if (p.name().equals(name)) return true;
            }
            return false;
        }

        public <R> R accept(NodeVisitor<R> v) { return v.visitFlowNode(this); }
    }

    /** {@code condition} is null when the edge has no WHEN guard. */
    record FlowEdge(Expr source, Expr target, Expr condition, int line, int column) implements Entry {
        public <R> R accept(NodeVisitor<R> v) { return v.visitFlowEdge(this); }
    }

    enum VerifyKind { ASSERT, PROPERTY, INVARIANT, POSTCONDITION, TEST }

    /** TEST entries carry {@code testRef}; all others carry {@code expression}. */
    record VerifyEntry(VerifyKind kind, Expr expression, String testRef, int line, int column) implements Entry {
        public <R> R accept(NodeVisitor<R> v) { return v.visitVerifyEntry(this); }
    }
}
