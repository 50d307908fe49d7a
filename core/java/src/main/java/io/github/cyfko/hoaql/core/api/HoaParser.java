package io.github.cyfko.hoaql.core.api;

import io.github.cyfko.hoaql.core.exception.HoaParseException;
import io.github.cyfko.hoaql.core.model.Automaton;

/**
 * Interface defining the contract for reading HOA documents into {@link Automaton} values.
 * <p>
 * Implementations check the text against the HOA grammar, resolve alias references and
 * enforce the consistency rules of the format, so that every returned automaton is
 * well formed.
 * </p>
 *
 * <p><strong>Example Usage:</strong></p>
 * <pre>{@code
 * HoaParser parser = new BasicHoaParser();
 * Automaton automaton = parser.parse("""
 *     HOA: v1
 *     States: 1
 *     Start: 0
 *     Acceptance: 1 Inf(0)
 *     --BODY--
 *     State: 0 {0}
 *     0
 *     --END--
 *     """);
 * }</pre>
 *
 * <p>Implementations must be thread-safe: a single parser may serve concurrent calls.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see HoaPrinter
 */
public interface HoaParser {

    /**
     * Parses one complete HOA document, from {@code HOA:} to {@code --END--}.
     *
     * @param text the document text
     * @return the parsed automaton
     * @throws HoaParseException if the text is not a valid HOA document; the concrete subtype
     *                           tells a syntax error from a semantic one
     */
    Automaton parse(String text) throws HoaParseException;
}
