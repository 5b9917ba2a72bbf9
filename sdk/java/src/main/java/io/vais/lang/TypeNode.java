package io.vais.lang;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declared types of INPUT and OUTPUT fields. Composite variants own their
 * nested types.
 */
public sealed interface TypeNode extends Node {

    /** INT32, STRING, BOOL, ... */
    record Primitive(String name, int line, int column) implements TypeNode {
        public <R> R accept(NodeVisitor<R> v) { return v.visitPrimitive(this); }
    }

    record ArrayOf(TypeNode element, int line, int column) implements TypeNode {
        public <R> R accept(NodeVisitor<R> v) { return v.visitArrayOf(this); }
    }

    record MapOf(TypeNode key, TypeNode value, int line, int column) implements TypeNode {
        public <R> R accept(NodeVisitor<R> v) { return v.visitMapOf(this); }
    }

    record Member(String name, TypeNode type) {}

    /** Members keep declaration order, repeated names included. */
    record Struct(List<Member> members, int line, int column) implements TypeNode {
        public Struct {
            members = List.copyOf(members);
        }

        /** Name to type. A repeated name keeps its first position and its last declared type. */
        public Map<String, TypeNode> fields() {
            Map<String, TypeNode> out = new LinkedHashMap<>();
            for (Member m : members) out.put(m.name(), m.type());
            return out;
        }

        public <R> R accept(NodeVisitor<R> v) { return v.visitStruct(this); }
    }

    record OptionalOf(TypeNode inner, int line, int column) implements TypeNode {
        public <R> R accept(NodeVisitor<R> v) { return v.visitOptionalOf(this); }
    }

    record UnionOf(List<TypeNode> alternatives, int line, int column) implements TypeNode {
        public UnionOf {
            alternatives = List.copyOf(alternatives);
        }

        public <R> R accept(NodeVisitor<R> v) { return v.visitUnionOf(this); }
    }

    /** A type defined outside the document, e.g. {@code @types.Order}. */
    record Ref(String ref, int line, int column) implements TypeNode {
        public <R> R accept(NodeVisitor<R> v) { return v.visitRef(this); }
    }
}
