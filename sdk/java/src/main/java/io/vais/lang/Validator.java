package io.vais.lang;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Semantic checks over a parsed {@link Document}. Never throws: every pass
 * runs regardless of earlier findings, so one missing block can cascade into
 * several reference diagnostics.
 *
 * <p>An instance holds the field maps of the last run; use {@link #validate}
 * when only the diagnostics are needed.
 */
public final class Validator {
    private static final Logger logger = LoggerFactory.getLogger(Validator.class);

    private static final List<String> REQUIRED_META_KEYS = List.of("DOMAIN", "DETERMINISM");

    private static final Map<Entry.Op, List<String>> REQUIRED_PARAMS = new EnumMap<>(Map.of(
        Entry.Op.MAP, List.of("fn"),
        Entry.Op.FILTER, List.of("condition"),
        Entry.Op.REDUCE, List.of("fn"),
        Entry.Op.FETCH, List.of("source"),
        Entry.Op.STORE, List.of("target")
    ));

    private List<Diagnostic> diagnostics = new ArrayList<>();
    private final Map<String, TypeNode> inputFields = new LinkedHashMap<>();
    private final Map<String, TypeNode> outputFields = new LinkedHashMap<>();
    private final Map<String, Entry.FlowNode> flowNodes = new LinkedHashMap<>();
    private final Set<String> externalRefs = new LinkedHashSet<>();

    public static List<Diagnostic> validate(Document doc) {
        return new Validator().run(doc);
    }

    public List<Diagnostic> run(Document doc) {
        diagnostics = new ArrayList<>();
        inputFields.clear();
        outputFields.clear();
        flowNodes.clear();
        externalRefs.clear();

        checkBlocksPresent(doc);
        collectFields(doc);

        checkMeta(doc.meta());
        checkFieldTypes(doc.input() != null ? doc.input().fields() : List.of());
        checkFieldTypes(doc.output() != null ? doc.output().fields() : List.of());
        checkIntent(doc.intent());
        checkConstraints(doc.constraint());
        checkFlow(doc.flow());
        checkExecution(doc.execution());
        checkVerify(doc.verify());

        checkCrossReferences(doc);

        if (logger.isDebugEnabled()) {
            long errors = diagnostics.stream().filter(Diagnostic::isError).count();
            logger.debug("Validated {}: {} diagnostics, {} errors", doc, diagnostics.size(), errors);
        }
        return Collections.unmodifiableList(diagnostics);
    }

    /** Input field name to declared type, first declaration wins. */
    public Map<String, TypeNode> inputFields() {
        return Collections.unmodifiableMap(inputFields);
    }

    public Map<String, TypeNode> outputFields() {
        return Collections.unmodifiableMap(outputFields);
    }

    public Map<String, Entry.FlowNode> flowNodes() {
        return Collections.unmodifiableMap(flowNodes);
    }

    /** External references seen in constraint and intent expressions and TEST entries. */
    public Set<String> externalRefs() {
        return Collections.unmodifiableSet(externalRefs);
    }

    // --- pass 1 ---

    private void checkBlocksPresent(Document doc) {
        if (doc.unit() == null) report(DiagnosticCode.MISSING_UNIT, doc);
        if (doc.meta() == null) report(DiagnosticCode.MISSING_META, doc);
        if (doc.input() == null) report(DiagnosticCode.MISSING_INPUT, doc);
        if (doc.output() == null) report(DiagnosticCode.MISSING_OUTPUT, doc);
        if (doc.intent() == null) report(DiagnosticCode.MISSING_INTENT, doc);
        if (doc.constraint() == null) report(DiagnosticCode.MISSING_CONSTRAINT, doc);
        if (doc.flow() == null) report(DiagnosticCode.MISSING_FLOW, doc);
        if (doc.execution() == null) report(DiagnosticCode.MISSING_EXECUTION, doc);
        if (doc.verify() == null) report(DiagnosticCode.MISSING_VERIFY, doc);
    }

    // --- pass 2 ---

    private void collectFields(Document doc) {
        if (doc.input() != null) {
            for (Entry.Field f : doc.input().fields()) {
                if (inputFields.putIfAbsent(f.name(), f.type()) != null) {
                    error(DiagnosticCode.DUPLICATE_INPUT_FIELD, "Duplicate input field: " + f.name(), f);
                }
            }
        }
        if (doc.output() != null) {
            for (Entry.Field f : doc.output().fields()) {
                if (outputFields.putIfAbsent(f.name(), f.type()) != null) {
                    error(DiagnosticCode.DUPLICATE_OUTPUT_FIELD, "Duplicate output field: " + f.name(), f);
                }
            }
        }
        if (doc.flow() != null) {
            for (Entry.FlowNode n : doc.flow().nodes()) {
                if (flowNodes.putIfAbsent(n.id(), n) != null) {
                    error(DiagnosticCode.DUPLICATE_FLOW_NODE, "Duplicate flow node: " + n.id(), n);
                }
            }
        }
    }

    // --- pass 3 ---

    private void checkMeta(Block.Meta meta) {
        if (meta == null) return;
        Set<String> found = new HashSet<>();
        for (Entry.MetaEntry e : meta.entries()) found.add(e.key());
        for (String key : REQUIRED_META_KEYS) {
            if (!found.contains(key)) {
                warn(DiagnosticCode.MISSING_META_ENTRY, "Missing required META entry: " + key, meta);
            }
        }
        for (Entry.MetaEntry e : meta.entries()) {
            if (e.key().equals("DETERMINISM") && !(e.value() instanceof Boolean)) {
                error(DiagnosticCode.INVALID_META_VALUE, "DETERMINISM must be boolean (true/false)", e);
            }
        }
    }

    private void checkFieldTypes(List<Entry.Field> fields) {
        for (Entry.Field f : fields) checkType(f.type());
    }

    private void checkType(TypeNode type) {
        if (type instanceof TypeNode.ArrayOf a) {
            checkType(a.element());
        } else if (type instanceof TypeNode.MapOf m) {
            checkType(m.key());
            checkType(m.value());
        } else if (type instanceof TypeNode.Struct s) {
            for (TypeNode.Member member : s.members()) checkType(member.type());
        } else if (type instanceof TypeNode.OptionalOf o) {
            checkType(o.inner());
        } else if (type instanceof TypeNode.UnionOf u) {
            for (TypeNode alt : u.alternatives()) checkType(alt);
        }
    }

    private void checkIntent(Block.Intent intent) {
        if (intent == null) return;
        if (intent.goal() == null) {
            error(DiagnosticCode.MISSING_GOAL_TYPE, "Missing GOAL type in INTENT", intent);
        }
        Entry.GoalSpec spec = intent.spec();
        if (spec != null) {
            if (spec.inputs().isEmpty()) {
                error(DiagnosticCode.MISSING_GOAL_INPUTS, "GOAL must have at least one input", intent);
            }
            if (spec.outputs().isEmpty()) {
                error(DiagnosticCode.MISSING_GOAL_OUTPUTS, "GOAL must have at least one output", intent);
            }
        }
    }

    private void checkConstraints(Block.Constraint constraint) {
        if (constraint == null) return;
        for (Entry.ConstraintEntry c : constraint.entries()) checkRefs(c.expression());
    }

    private void checkFlow(Block.Flow flow) {
        if (flow == null) return;
        for (Entry.FlowNode node : flow.nodes()) {
            for (String param : REQUIRED_PARAMS.getOrDefault(node.op(), List.of())) {
                if (!node.hasParam(param)) {
                    warn(DiagnosticCode.MISSING_NODE_PARAM,
                        "Node '" + node.id() + "' missing required param: " + param, node);
                }
            }
        }

        Set<String> connected = new HashSet<>();
        for (Entry.FlowEdge edge : flow.edges()) {
            Endpoint source = Endpoint.of(edge.source());
            if (source != null) {
                connected.add(source.base());
                checkEndpoint(source, edge, DiagnosticCode.UNKNOWN_SOURCE_NODE, "source");
            }
            Endpoint target = Endpoint.of(edge.target());
            if (target != null) {
                connected.add(target.base());
                checkEndpoint(target, edge, DiagnosticCode.UNKNOWN_TARGET_NODE, "target");
            }
        }

        for (Entry.FlowNode node : flowNodes.values()) {
            if (!connected.contains(node.id())) {
                warn(DiagnosticCode.DISCONNECTED_NODE, "Node '" + node.id() + "' is not connected to any edge", node);
            }
        }
    }

    private void checkEndpoint(Endpoint ep, Entry.FlowEdge edge, DiagnosticCode unknownNode, String role) {
        switch (ep.base()) {
            case "INPUT" -> {
                if (ep.port() != null && !inputFields.containsKey(ep.port())) {
                    error(DiagnosticCode.UNKNOWN_EDGE_INPUT, "Unknown input field: " + ep.port(), edge);
                }
            }
            case "OUTPUT" -> {
                if (ep.port() != null && !outputFields.containsKey(ep.port())) {
                    error(DiagnosticCode.UNKNOWN_EDGE_OUTPUT, "Unknown output field: " + ep.port(), edge);
                }
            }
            default -> {
                if (!flowNodes.containsKey(ep.base())) {
                    error(unknownNode, "Unknown " + role + " node: " + ep.base(), edge);
                }
            }
        }
    }

    private void checkExecution(Block.Execution execution) {
        if (execution == null) return;
        if (execution.memory() == Block.Memory.BOUNDED && execution.memoryLimit() == null) {
            warn(DiagnosticCode.MISSING_MEMORY_LIMIT, "BOUNDED memory requires a limit (e.g., 256MB)", execution);
        }
    }

    private void checkVerify(Block.Verify verify) {
        if (verify == null) return;
        for (Entry.VerifyEntry e : verify.entries()) {
            if (e.kind() == Entry.VerifyKind.TEST) {
                if (e.testRef() == null || e.testRef().isEmpty()) {
                    error(DiagnosticCode.MISSING_TEST_REF, "TEST entry requires a reference", e);
                } else {
                    externalRefs.add(e.testRef());
                }
            } else if (e.expression() == null) {
                error(DiagnosticCode.MISSING_VERIFY_EXPR, e.kind() + " entry requires an expression", e);
            }
        }
    }

    // --- pass 4 ---

    private void checkCrossReferences(Document doc) {
        Block.Intent intent = doc.intent();
        if (intent == null || intent.spec() == null) return;
        for (Expr e : intent.spec().inputs()) checkRefs(e);
        for (Expr e : intent.spec().outputs()) checkRefs(e);
    }

    /** Resolves {@code input.x} / {@code output.x} against the collected field maps. */
    private void checkRefs(Expr expr) {
        if (expr instanceof Expr.FieldAccess fa) {
            if (fa.base() instanceof Expr.Identifier id) {
                if (id.name().equals("input") && !inputFields.containsKey(fa.field())) {
                    error(DiagnosticCode.UNKNOWN_INPUT_REF, "Unknown input field: " + fa.field(), fa);
                } else if (id.name().equals("output") && !outputFields.containsKey(fa.field())) {
                    error(DiagnosticCode.UNKNOWN_OUTPUT_REF, "Unknown output field: " + fa.field(), fa);
                }
            } else {
                checkRefs(fa.base());
            }
        } else if (expr instanceof Expr.ExternalRef ref) {
            externalRefs.add(ref.ref());
        } else if (expr instanceof Expr.Binary b) {
            checkRefs(b.left());
            checkRefs(b.right());
        } else if (expr instanceof Expr.Unary u) {
            checkRefs(u.operand());
        } else if (expr instanceof Expr.Call c) {
            for (Expr arg : c.arguments()) checkRefs(arg);
        } else if (expr instanceof Expr.Index i) {
            checkRefs(i.base());
            checkRefs(i.index());
        }
    }

    private void report(DiagnosticCode code, Node at) {
        error(code, code.title(), at);
    }

    private void error(DiagnosticCode code, String message, Node at) {
        diagnostics.add(new Diagnostic(code.code(), message, Severity.ERROR, at.line(), at.column()));
    }

    private void warn(DiagnosticCode code, String message, Node at) {
        diagnostics.add(new Diagnostic(code.code(), message, Severity.WARNING, at.line(), at.column()));
    }

    /** An edge endpoint: {@code node}, {@code node.port}, {@code INPUT.x} or {@code OUTPUT.x}. */
    private record Endpoint(String base, String port) {
        static Endpoint of(Expr expr) {
            if (expr instanceof Expr.Identifier id) return new Endpoint(id.name(), null);
            if (expr instanceof Expr.FieldAccess fa && fa.base() instanceof Expr.Identifier id) {
                return new Endpoint(id.name(), fa.field());
            }
            return null;
        }
    }
}
