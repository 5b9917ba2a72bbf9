package io.vais.lang;

/**
 * One validator finding. {@code code} is stable across releases.
 */
public record Diagnostic(String code, String message, Severity severity, int line, int column) {

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return "[" + severity + "] " + code + " at L" + line + ":C" + column + ": " + message;
    }
}
