package io.vais.lang;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

class AstPrinterTest {

    static String inline(String expr) {
        return AstPrinter.print(Parser.parseExpression(expr));
    }

    @Test void printsWholeDocument() {
        String expected = String.join("\n",
            "Document:",
            "  UNIT FUNCTION examples.add V1.0.0",
            "  META:",
            "    DOMAIN: examples.math",
            "    DETERMINISM: true",
            "    PURE: true",
            "  INPUT:",
            "    a: INT32",
            "    b: INT32",
            "  OUTPUT:",
            "    sum: INT32",
            "  INTENT: GOAL TRANSFORM",
            "    input.a, input.b -> output.sum",
            "    PRIORITY CORRECTNESS",
            "  CONSTRAINT:",
            "    REQUIRE (input.a >= -1000000) AND (input.a <= 1000000)",
            "    REQUIRE (input.b >= -1000000) AND (input.b <= 1000000)",
            "  FLOW:",
            "    NODE add : TRANSFORM (op=ADD, left=input.a, right=input.b)",
            "    EDGE INPUT.a -> add",
            "    EDGE INPUT.b -> add",
            "    EDGE add -> OUTPUT.sum",
            "  EXECUTION:",
            "    PARALLEL false",
            "    TARGET ANY",
            "    MEMORY STACK_ONLY",
            "    ISOLATION NONE",
            "    CACHE NONE",
            "  VERIFY:",
            "    ASSERT output.sum == (input.a + input.b)",
            "    TEST @tests.math.add_positive",
            "");
        assertEquals(expected, AstPrinter.print(Parser.parse(Units.add())));
    }

    @Test void printsEveryFeature() {
        List<String> lines = List.of(AstPrinter.print(Parser.parse(Units.orders())).split("\n"));
        assertTrue(lines.contains("  UNIT PIPELINE shop.orders.enrich V2.1"));
        assertTrue(lines.contains("    orders: ARRAY<STRUCT { id : STRING, amount : FLOAT64 }> [LEN(orders) > 0]"));
        assertTrue(lines.contains("    region: OPTIONAL<STRING>"));
        assertTrue(lines.contains("    lookup: MAP<STRING, UNION<INT64 | @types.Money>>"));
        assertTrue(lines.contains("    PRIORITY CORRECTNESS > LATENCY > MEMORY"));
        assertTrue(lines.contains("    ON_FAILURE FALLBACK @fallbacks.empty_orders"));
        assertTrue(lines.contains("    REQUIRE WITHIN 250ms"));
        assertTrue(lines.contains("    PREFER NOT input.orders[0].amount < 0"));
        assertTrue(lines.contains("    NODE price : @ops.price_orders (currency=\"EUR\")"));
        assertTrue(lines.contains("    EDGE keep -> price WHEN input.region != \"eu\""));
        assertTrue(lines.contains("    MEMORY BOUNDED 256MB"));
        assertTrue(lines.contains("    CACHE LRU 128"));
        assertTrue(lines.contains("    POSTCONDITION output.enriched[0].id match /ORD-\\d+/"));
    }

    @Test void nestedBinaryOperandsAreParenthesised() {
        assertEquals("a + (b * c)", inline("a + b * c"));
        assertEquals("(a + b) * c", inline("(a + b) * c"));
        assertEquals("a + b", inline("(a + b)"));
    }

    @Test void unaryForms() {
        assertEquals("-x", inline("-x"));
        assertEquals("NOT (a or b)", inline("NOT (a or b)"));
        assertEquals("not flag", inline("not flag"));
    }

    @Test void literalsRoundTripSyntax() {
        assertEquals("\"a\\\"b\\n\"", inline("\"a\\\"b\\n\""));
        assertEquals("/x+/", inline("/x+/"));
        assertEquals("100ms", inline("100ms"));
        assertEquals("VOID", inline("VOID"));
        assertEquals("xs[0].id", inline("xs[0].id"));
        assertEquals("SUM(xs, 1)", inline("SUM(xs, 1)"));
    }

    @Test void printsSingleEntry() {
        Entry.FlowNode node = Parser.parse(Units.add()).flow().nodes().get(0);
        assertEquals("NODE add : TRANSFORM (op=ADD, left=input.a, right=input.b)\n", AstPrinter.print(node));
    }

    @Test void printsDocumentWithMissingBlocks() {
        Document empty = new Document(null, null, null, null, null, null, null, null, null, 1, 1);
        assertEquals("Document:\n", AstPrinter.print(empty));
        assertEquals("Document(UNKNOWN)", empty.toString());
    }

    @Test void visitorFallsBackToDefault() {
        NodeVisitor<String> v = new NodeVisitor<>() {
            @Override
            public String visitDefault(Node node) {
                return "other";
            }

            @Override
            public String visitFlowNode(Entry.FlowNode node) {
                return "node " + node.id();
            }
        };
        Block.Flow flow = Parser.parse(Units.add()).flow();
        assertEquals("node add", flow.nodes().get(0).accept(v));
        assertEquals("other", flow.accept(v));
        assertEquals("other", flow.edges().get(0).accept(v));
        assertNull(flow.accept(new NodeVisitor<String>() {}));
    }
}
