package io.github.cyfko.hoaql.core.exception;

import io.github.cyfko.hoaql.core.api.HoaParser;

/**
 * Base type of every error raised while reading an HOA document.
 * <p>
 * Parsing never recovers: the first problem found aborts the call and surfaces as one of
 * the two concrete families below, so callers can catch this type alone.
 * </p>
 *
 * <ul>
 *   <li>{@link HoaSyntaxException}: the text does not match the grammar, or the input
 *       violates the parser's configured limits</li>
 *   <li>{@link HoaValidationException}: the text is well formed but breaks a semantic rule
 *       of the format (duplicate header, undefined alias, inconsistent counts...)</li>
 * </ul>
 *
 * <pre>{@code
 * try {
 *     Automaton automaton = parser.parse(text);
 * } catch (HoaParseException e) {
 *     log.warning("Rejected automaton: " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see HoaParser
 */
public abstract class HoaParseException extends RuntimeException {

    /**
     * @param message the message describing the cause of the exception
     */
    protected HoaParseException(String message) {
        super(message);
    }

    /**
     * @param message the message describing the cause of the exception
     * @param cause   the original cause of this exception
     */
    protected HoaParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
