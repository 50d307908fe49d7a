package io.github.cyfko.hoaql.core;

import io.github.cyfko.hoaql.core.api.HoaParser;
import io.github.cyfko.hoaql.core.api.HoaPrinter;
import io.github.cyfko.hoaql.core.exception.HoaParseException;
import io.github.cyfko.hoaql.core.impl.BasicHoaParser;
import io.github.cyfko.hoaql.core.impl.CanonicalHoaPrinter;
import io.github.cyfko.hoaql.core.model.Automaton;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Entry point for reading and writing HOA documents with the default components.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Automaton automaton = HoaFormat.parse(text);
 * String canonical = HoaFormat.print(automaton);
 *
 * try (Writer writer = Files.newBufferedWriter(path)) {
 *     HoaFormat.dump(automaton, writer);
 * }
 * }</pre>
 *
 * <p>Uses a {@link BasicHoaParser} with default policy and a {@link CanonicalHoaPrinter}.
 * Build those directly for a custom configuration.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class HoaFormat {

    private static final HoaParser PARSER = new BasicHoaParser();
    private static final HoaPrinter PRINTER = new CanonicalHoaPrinter();

    private HoaFormat() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Parses an HOA document.
     *
     * @param text the document text
     * @return the automaton
     * @throws HoaParseException if the text is not a valid HOA document
     */
    public static Automaton parse(String text) throws HoaParseException {
        return PARSER.parse(text);
    }

    /**
     * Prints {@code automaton} in canonical form.
     */
    public static String print(Automaton automaton) {
        return PRINTER.print(automaton);
    }

    /**
     * Writes {@code automaton} in canonical form to {@code out}.
     *
     * @param automaton the automaton to write
     * @param out       the destination
     * @throws UncheckedIOException if the destination fails
     */
    public static void dump(Automaton automaton, Appendable out) {
        try {
            PRINTER.print(automaton, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write HOA document", e);
        }
    }
}
