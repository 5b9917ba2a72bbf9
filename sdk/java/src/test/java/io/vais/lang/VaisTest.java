package io.vais.lang;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

class VaisTest {

    @Test void validDocument() {
        Vais.CheckResult r = Vais.check(Units.orders());
        assertTrue(r.isValid());
        assertTrue(r.diagnostics().isEmpty());
        assertEquals("shop.orders.enrich", r.document().unit().id().fullName());
    }

    @Test void warningsDoNotInvalidate() {
        Vais.CheckResult r = Vais.check(Units.addWith("EXECUTION", "ENDEXECUTION", "  MEMORY BOUNDED"));
        assertTrue(r.isValid());
        assertEquals(1, r.diagnostics().size());
        assertTrue(r.errors().isEmpty());
    }

    @Test void errorsInvalidate() {
        Vais.CheckResult r = Vais.check(Units.addWith("CONSTRAINT", "ENDCONSTRAINT", "  REQUIRE input.zzz > 0"));
        assertFalse(r.isValid());
        assertEquals("E5001", r.errors().get(0).code());
    }

    @Test void parseErrorsPropagate() {
        ParseException e = assertThrows(ParseException.class, () -> Vais.check("UNIT FUNCTION"));
        assertEquals(TokenType.EOF, e.token().type());
    }

    @Test void optionsReachParser() {
        ParseOptions opts = new ParseOptions();
        opts.requireEnd = false;
        String src = Units.add().replace("\nEND\n", "\n");
        assertTrue(Vais.check(src, opts).isValid());
        assertThrows(ParseException.class, () -> Vais.check(src));
        assertNotNull(Vais.parse(src, opts));
    }

    @Test void tokenizeAndPrint() {
        List<Token> tokens = Vais.tokenize("UNIT FUNCTION a");
        assertEquals(TokenType.UNIT, tokens.get(0).type());
        assertEquals("Token(UNIT, 'UNIT', L1:C1)", tokens.get(0).toString());
        assertTrue(Vais.print(Vais.parse(Units.add())).startsWith("Document:\n  UNIT FUNCTION examples.add"));
    }

    @Test void independentChecksRunInParallel() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Vais.CheckResult>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                String src = i % 2 == 0 ? Units.add() : Units.orders();
                futures.add(pool.submit(() -> Vais.check(src)));
            }
            for (Future<Vais.CheckResult> f : futures) {
                assertTrue(f.get(10, TimeUnit.SECONDS).isValid());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
