package io.vais.lang;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Fixture documents from {@code src/test/resources/units}. */
final class Units {
    private Units() {}

    static String load(String name) {
        try (InputStream in = Units.class.getResourceAsStream("/units/" + name)) {
            if (in == null) throw new IllegalStateException("missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Two INT32 inputs summed into one output; validates clean. */
    static String add() {
        return load("add_numbers.vais");
    }

    /** Exercises every block feature; validates clean. */
    static String orders() {
        return load("order_pipeline.vais");
    }

    /** Replaces the body between {@code open} and {@code close} keywords of {@link #add()}. */
    static String addWith(String open, String close, String body) {
        String src = add();
        int start = src.indexOf(open + "\n") + open.length() + 1;
        int end = src.indexOf(close);
        return src.substring(0, start) + body + "\n" + src.substring(end);
    }
}
