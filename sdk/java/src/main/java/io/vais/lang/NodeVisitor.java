package io.vais.lang;

/**
 * Double-dispatch visitor over the closed node set. Every method falls back
 * to {@link #visitDefault(Node)}, so implementations override only what they
 * care about.
 */
public interface NodeVisitor<R> {

    default R visitDefault(Node node) { return null; }

    default R visitDocument(Document node) { return visitDefault(node); }

    // blocks
    default R visitUnit(Block.Unit node) { return visitDefault(node); }
    default R visitMeta(Block.Meta node) { return visitDefault(node); }
    default R visitInput(Block.Input node) { return visitDefault(node); }
    default R visitOutput(Block.Output node) { return visitDefault(node); }
    default R visitIntent(Block.Intent node) { return visitDefault(node); }
    default R visitConstraint(Block.Constraint node) { return visitDefault(node); }
    default R visitFlow(Block.Flow node) { return visitDefault(node); }
    default R visitExecution(Block.Execution node) { return visitDefault(node); }
    default R visitVerify(Block.Verify node) { return visitDefault(node); }

    // entries
    default R visitMetaEntry(Entry.MetaEntry node) { return visitDefault(node); }
    default R visitField(Entry.Field node) { return visitDefault(node); }
    default R visitGoalSpec(Entry.GoalSpec node) { return visitDefault(node); }
    default R visitConstraintEntry(Entry.ConstraintEntry node) { return visitDefault(node); }
    default R visitParam(Entry.Param node) { return visitDefault(node); }
    default R visitFlowNode(Entry.FlowNode node) { return visitDefault(node); }
    default R visitFlowEdge(Entry.FlowEdge node) { return visitDefault(node); }
    default R visitVerifyEntry(Entry.VerifyEntry node) { return visitDefault(node); }

    // types
    default R visitPrimitive(TypeNode.Primitive node) { return visitDefault(node); }
    default R visitArrayOf(TypeNode.ArrayOf node) { return visitDefault(node); }
    default R visitMapOf(TypeNode.MapOf node) { return visitDefault(node); }
    default R visitStruct(TypeNode.Struct node) { return visitDefault(node); }
    default R visitOptionalOf(TypeNode.OptionalOf node) { return visitDefault(node); }
    default R visitUnionOf(TypeNode.UnionOf node) { return visitDefault(node); }
    default R visitRef(TypeNode.Ref node) { return visitDefault(node); }

    // expressions
    default R visitLiteral(Expr.Literal node) { return visitDefault(node); }
    default R visitIdentifier(Expr.Identifier node) { return visitDefault(node); }
    default R visitQualifiedName(Expr.QualifiedName node) { return visitDefault(node); }
    default R visitExternalRef(Expr.ExternalRef node) { return visitDefault(node); }
    default R visitFieldAccess(Expr.FieldAccess node) { return visitDefault(node); }
    default R visitBinary(Expr.Binary node) { return visitDefault(node); }
    default R visitUnary(Expr.Unary node) { return visitDefault(node); }
    default R visitCall(Expr.Call node) { return visitDefault(node); }
    default R visitIndex(Expr.Index node) { return visitDefault(node); }
}
