package io.vais.lang;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a tree as indented text. Blocks and entries get one line each;
 * types and expressions are written back in source syntax, with nested
 * binary operands parenthesised.
 */
public final class AstPrinter implements NodeVisitor<Void> {
    private final StringBuilder out = new StringBuilder();
    private final SourceRenderer inline = new SourceRenderer();
    private int indent;

    public static String print(Node node) {
        AstPrinter p = new AstPrinter();
        if (node instanceof Expr || node instanceof TypeNode) {
            return node.accept(p.inline);
        }
        node.accept(p);
        return p.out.toString();
    }

    private void line(String text) {
        out.append("  ".repeat(indent)).append(text).append('\n');
    }

    private void nested(List<? extends Node> children) {
        indent++;
        for (Node child : children) child.accept(this);
        indent--;
    }

    private String render(Node node) {
        return node == null ? "?" : node.accept(inline);
    }

    @Override
    public Void visitDocument(Document node) {
        line("Document:");
        indent++;
        for (Block b : new Block[]{node.unit(), node.meta(), node.input(), node.output(), node.intent(),
                node.constraint(), node.flow(), node.execution(), node.verify()}) {
            if (b != null) b.accept(this);
        }
        indent--;
        return null;
    }

    @Override
    public Void visitUnit(Block.Unit node) {
        String kind = node.kind() != null ? node.kind().name() : "UNKNOWN";
        String id = node.id() != null ? node.id().fullName() : "UNKNOWN";
        line("UNIT " + kind + " " + id + (node.version() != null ? " " + node.version() : ""));
        return null;
    }

    @Override
    public Void visitMeta(Block.Meta node) {
        line("META:");
        nested(node.entries());
        return null;
    }

    @Override
    public Void visitMetaEntry(Entry.MetaEntry node) {
        line(node.key() + ": " + node.value());
        return null;
    }

    @Override
    public Void visitInput(Block.Input node) {
        line("INPUT:");
        nested(node.fields());
        return null;
    }

    @Override
    public Void visitOutput(Block.Output node) {
        line("OUTPUT:");
        nested(node.fields());
        return null;
    }

    @Override
    public Void visitField(Entry.Field node) {
        String text = node.name() + ": " + render(node.type());
        if (!node.constraints().isEmpty()) text += " [" + join(node.constraints()) + "]";
        line(text);
        return null;
    }

    @Override
    public Void visitIntent(Block.Intent node) {
        line("INTENT: GOAL " + (node.goal() != null ? node.goal().name() : "UNKNOWN"));
        indent++;
        if (node.spec() != null) node.spec().accept(this);
        if (!node.priorities().isEmpty()) {
            line("PRIORITY " + node.priorities().stream().map(Enum::name).collect(Collectors.joining(" > ")));
        }
        if (node.onFailure() != null) {
            line("ON_FAILURE " + node.onFailure() + (node.fallback() != null ? " " + render(node.fallback()) : ""));
        }
        indent--;
        return null;
    }

    @Override
    public Void visitGoalSpec(Entry.GoalSpec node) {
        line(join(node.inputs()) + " -> " + join(node.outputs()));
        return null;
    }

    @Override
    public Void visitConstraint(Block.Constraint node) {
        line("CONSTRAINT:");
        nested(node.entries());
        return null;
    }

    @Override
    public Void visitConstraintEntry(Entry.ConstraintEntry node) {
        if (node.expression() instanceof Expr.Literal lit && lit.kind() == Expr.Literal.Kind.DURATION) {
            line(node.kind() + " WITHIN " + lit.text());
        } else {
            line(node.kind() + " " + render(node.expression()));
        }
        return null;
    }

    @Override
    public Void visitFlow(Block.Flow node) {
        line("FLOW:");
        nested(node.nodes());
        nested(node.edges());
        return null;
    }

    @Override
    public Void visitFlowNode(Entry.FlowNode node) {
        String op = node.customOp() != null ? node.customOp() : String.valueOf(node.op());
        String text = "NODE " + node.id() + " : " + op;
        if (!node.params().isEmpty()) {
            text += " (" + node.params().stream()
                .map(p -> p.name() + "=" + render(p.value()))
                .collect(Collectors.joining(", ")) + ")";
        }
        line(text);
        return null;
    }

    @Override
    public Void visitParam(Entry.Param node) {
        line(node.name() + "=" + render(node.value()));
        return null;
    }

    @Override
    public Void visitFlowEdge(Entry.FlowEdge node) {
        String text = "EDGE " + render(node.source()) + " -> " + render(node.target());
        if (node.condition() != null) text += " WHEN " + render(node.condition());
        line(text);
        return null;
    }

    @Override
    public Void visitExecution(Block.Execution node) {
        line("EXECUTION:");
        indent++;
        line("PARALLEL " + node.parallel());
        line("TARGET " + node.target());
        line("MEMORY " + node.memory() + (node.memoryLimit() != null ? " " + node.memoryLimit() : ""));
        line("ISOLATION " + node.isolation());
        line("CACHE " + node.cache() + (node.cacheSize() != null ? " " + node.cacheSize() : ""));
        indent--;
        return null;
    }

    @Override
    public Void visitVerify(Block.Verify node) {
        line("VERIFY:");
        nested(node.entries());
        return null;
    }

    @Override
    public Void visitVerifyEntry(Entry.VerifyEntry node) {
        if (node.kind() == Entry.VerifyKind.TEST) {
            line("TEST " + node.testRef());
        } else {
            line(node.kind() + " " + render(node.expression()));
        }
        return null;
    }

    /** Types and expressions are leaves at this level. */
    @Override
    public Void visitDefault(Node node) {
        line(render(node));
        return null;
    }

    private String join(List<? extends Node> nodes) {
        return nodes.stream().map(this::render).collect(Collectors.joining(", "));
    }

    /** Inline rendering of types and expressions. */
    private static final class SourceRenderer implements NodeVisitor<String> {

        @Override
        public String visitDefault(Node node) {
            return node.getClass().getSimpleName();
        }

        @Override
        public String visitPrimitive(TypeNode.Primitive node) {
            return node.name();
        }

        @Override
        public String visitArrayOf(TypeNode.ArrayOf node) {
            return "ARRAY<" + node.element().accept(this) + ">";
        }

        @Override
        public String visitMapOf(TypeNode.MapOf node) {
            return "MAP<" + node.key().accept(this) + ", " + node.value().accept(this) + ">";
        }

        @Override
        public String visitStruct(TypeNode.Struct node) {
            return "STRUCT { " + node.members().stream()
                .map(m -> m.name() + " : " + m.type().accept(this))
                .collect(Collectors.joining(", ")) + " }";
        }

        @Override
        public String visitOptionalOf(TypeNode.OptionalOf node) {
            return "OPTIONAL<" + node.inner().accept(this) + ">";
        }

        @Override
        public String visitUnionOf(TypeNode.UnionOf node) {
            return "UNION<" + node.alternatives().stream()
                .map(t -> t.accept(this))
                .collect(Collectors.joining(" | ")) + ">";
        }

        @Override
        public String visitRef(TypeNode.Ref node) {
            return node.ref();
        }

        @Override
        public String visitLiteral(Expr.Literal node) {
            return switch (node.kind()) {
                case STRING -> "\"" + node.text()
                    .replace("\\", "\\\\").replace("\"", "\\\"")
                    .replace("\n", "\\n").replace("\t", "\\t") + "\"";
                case REGEX -> "/" + node.text() + "/";
                default -> node.text();
            };
        }

        @Override
        public String visitIdentifier(Expr.Identifier node) {
            return node.name();
        }

        @Override
        public String visitQualifiedName(Expr.QualifiedName node) {
            return node.fullName();
        }

        @Override
        public String visitExternalRef(Expr.ExternalRef node) {
            return node.ref();
        }

        @Override
        public String visitFieldAccess(Expr.FieldAccess node) {
            return node.base().accept(this) + "." + node.field();
        }

        @Override
        public String visitBinary(Expr.Binary node) {
            return operand(node.left()) + " " + node.operator() + " " + operand(node.right());
        }

        private String operand(Expr e) {
            String s = e.accept(this);
            return e instanceof Expr.Binary ? "(" + s + ")" : s;
        }

        @Override
        public String visitUnary(Expr.Unary node) {
            String operand = operand(node.operand());
            return node.operator().equals("-") ? "-" + operand : node.operator() + " " + operand;
        }

        @Override
        public String visitCall(Expr.Call node) {
            return node.name() + "(" + node.arguments().stream()
                .map(a -> a.accept(this))
                .collect(Collectors.joining(", ")) + ")";
        }

        @Override
        public String visitIndex(Expr.Index node) {
            return node.base().accept(this) + "[" + node.index().accept(this) + "]";
        }
    }
}
