package io.vais.lang;

import java.util.List;

/**
 * The nine top-level sections of a unit document.
 */
public sealed interface Block extends Node {

    enum UnitKind { FUNCTION, SERVICE, PIPELINE, MODULE }

    enum Goal { TRANSFORM, VALIDATE, AGGREGATE, FILTER, ROUTE, COMPOSE, FETCH }

    enum Priority { CORRECTNESS, PERFORMANCE, MEMORY, LATENCY, THROUGHPUT }

    enum FailureStrategy { ABORT, RETRY, FALLBACK, DEFAULT }

    enum Target { ANY, CPU, GPU, WASM, NATIVE }

    enum Memory { BOUNDED, UNBOUNDED, STACK_ONLY }

    enum Isolation { NONE, THREAD, PROCESS, CONTAINER }

    enum Cache { NONE, LRU, TTL }

    /** {@code version} is null when omitted. */
    record Unit(UnitKind kind, Expr.QualifiedName id, String version, int line, int column) implements Block {
        public <R> R accept(NodeVisitor<R> v) { return v.visitUnit(this); }
    }

    record Meta(List<Entry.MetaEntry> entries, int line, int column) implements Block {
        public Meta {
            entries = List.copyOf(entries);
        }

        public <R> R accept(NodeVisitor<R> v) { return v.visitMeta(this); }
    }

    record Input(List<Entry.Field> fields, int line, int column) implements Block {
        public Input {
            fields = List.copyOf(fields);
        }

        public <R> R accept(NodeVisitor<R> v) { return v.visitInput(this); }
    }

    record Output(List<Entry.Field> fields, int line, int column) implements Block {
        public Output {
            fields = List.copyOf(fields);
        }

        public <R> R accept(NodeVisitor<R> v) { return v.visitOutput(this); }
    }

    /**
     * {@code onFailure} and {@code fallback} are null when ON_FAILURE is absent;
     * {@code fallback} is only set for FALLBACK and DEFAULT.
     */
    record Intent(Goal goal, Entry.GoalSpec spec, List<Priority> priorities,
                  FailureStrategy onFailure, Expr fallback, int line, int column) implements Block {
        public Intent {
            priorities = List.copyOf(priorities);
        }

        public <R> R accept(NodeVisitor<R> v) { return v.visitIntent(this); }
    }

    record Constraint(List<Entry.ConstraintEntry> entries, int line, int column) implements Block {
        public Constraint {
            entries = List.copyOf(entries);
        }

        public <R> R accept(NodeVisitor<R> v) { return v.visitConstraint(this); }
    }

    record Flow(List<Entry.FlowNode> nodes, List<Entry.FlowEdge> edges, int line, int column) implements Block {
        public Flow {
            nodes = List.copyOf(nodes);
            edges = List.copyOf(edges);
        }

        public <R> R accept(NodeVisitor<R> v) { return v.visitFlow(this); }
    }

    /**
     * {@code memoryLimit} keeps the literal text (e.g. {@code 256MB}) and is
     * null unless supplied after BOUNDED; {@code cacheSize} is null unless
     * supplied after LRU or TTL.
     */
    record Execution(boolean parallel, Target target, Memory memory, String memoryLimit,
                     Isolation isolation, Cache cache, Long cacheSize, int line, int column) implements Block {
        public <R> R accept(NodeVisitor<R> v) { return v.visitExecution(this); }
    }

    record Verify(List<Entry.VerifyEntry> entries, int line, int column) implements Block {
        public Verify {
            entries = List.copyOf(entries);
        }

        public <R> R accept(NodeVisitor<R> v) { return v.visitVerify(this); }
    }
}
