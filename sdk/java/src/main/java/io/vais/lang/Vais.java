package io.vais.lang;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry points for the lexer, parser and validator pipeline.
 * Stateless; independent documents may be processed from any thread.
 */
public final class Vais {
    private static final Logger logger = LoggerFactory.getLogger(Vais.class);

    private Vais() {}

    /** A parsed document and its diagnostics. */
    public record CheckResult(Document document, List<Diagnostic> diagnostics) {
        public CheckResult {
            diagnostics = List.copyOf(diagnostics);
        }

        /** True when no ERROR-severity diagnostic was reported. */
        public boolean isValid() {
            return diagnostics.stream().noneMatch(Diagnostic::isError);
        }

        public List<Diagnostic> errors() {
            return diagnostics.stream().filter(Diagnostic::isError).toList();
        }
    }

    public static List<Token> tokenize(String source) {
        return Lexer.tokenize(source);
    }

    public static Document parse(String source) {
        return Parser.parse(source);
    }

    public static Document parse(String source, ParseOptions options) {
        return Parser.parse(source, options);
    }

    /**
     * Lexes, parses and validates one document.
     * @throws ParseException if the source is not syntactically valid
     */
    public static CheckResult check(String source) {
        return check(source, new ParseOptions());
    }

    public static CheckResult check(String source, ParseOptions options) {
        Document doc;
        try {
            doc = Parser.parse(source, options);
        } catch (ParseException e) {
            logger.debug("Parse failed: {}", e.getMessage());
            throw e;
        }
        CheckResult result = new CheckResult(doc, Validator.validate(doc));
        logger.debug("Checked {}: valid={}, diagnostics={}", doc, result.isValid(), result.diagnostics().size());
        return result;
    }

    public static String print(Node node) {
        return AstPrinter.print(node);
    }
}
