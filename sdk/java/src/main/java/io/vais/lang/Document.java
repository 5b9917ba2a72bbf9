package io.vais.lang;

/**
 * Root of a parsed unit. Slots are null when a block is absent; the parser
 * never produces such a document but the validator accepts one.
 */
public record Document(Block.Unit unit,
                       Block.Meta meta,
                       Block.Input input,
                       Block.Output output,
                       Block.Intent intent,
                       Block.Constraint constraint,
                       Block.Flow flow,
                       Block.Execution execution,
                       Block.Verify verify,
                       int line,
                       int column) implements Node {

    public <R> R accept(NodeVisitor<R> v) { return v.visitDocument(this); }

    @Override
    public String toString() {
        if (unit == null || unit.id() == null) return "Document(UNKNOWN)";
        String kind = unit.kind() != null ? unit.kind().name() : "UNKNOWN";
        return "Document(" + kind + " " + unit.id().fullName() + ")";
    }
}
