package io.github.cyfko.hoaql.core.exception;

import io.github.cyfko.hoaql.core.config.HoaPolicy;

/**
 * Exception thrown when an HOA document cannot be tokenized or parsed.
 * <p>
 * Raised for grammar errors reported by the generated lexer and parser, for tokens whose
 * text is rejected by a validated newtype, for structural problems the grammar cannot
 * express (an edge before any {@code State:} line, an acceptance atom other than
 * {@code Fin}/{@code Inf}), and for inputs that violate the active {@link HoaPolicy}.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parse("");
 * // → "HOA document cannot be null or blank"
 *
 * parser.parse("HOA: v1 States: 2 --BODY-- --END");
 * // → "line 1:26 token recognition error at: '--END'"
 *
 * parser.parse("HOA: v1 Acceptance: 1 Foo(0) --BODY-- --END--");
 * // → "Unknown acceptance atom 'Foo', expected Fin or Inf"
 * }</pre>
 *
 * <p>When the location of the problem is known, {@link #getLine()} and {@link #getColumn()}
 * return it (1-based line, 0-based column, as reported by the lexer); otherwise both
 * return {@code -1}.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class HoaSyntaxException extends HoaParseException {

    private final int line;
    private final int column;

    /**
     * Constructor with an explanatory error message and no location.
     *
     * @param message the message describing the cause of the exception
     */
    public HoaSyntaxException(String message) {
        this(message, (Throwable) null);
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     * <p>
     * Used when the syntax error is detected by a lower layer, typically an
     * {@link InvalidTokenException} raised while wrapping a token into a newtype.
     * </p>
     *
     * @param message the message describing the cause of the exception
     * @param cause   the original cause of this exception
     */
    public HoaSyntaxException(String message, Throwable cause) {
        super(message, cause);
        this.line = -1;
        this.column = -1;
    }

    /**
     * Constructor for errors located in the source text.
     *
     * @param line    1-based line of the offending token
     * @param column  0-based column of the offending token
     * @param message the message describing the cause of the exception
     */
    public HoaSyntaxException(int line, int column, String message) {
        super("line " + line + ":" + column + " " + message);
        this.line = line;
        this.column = column;
    }

    /**
     * @return the 1-based line of the error, or {@code -1} if unknown
     */
    public int getLine() {
        return line;
    }

    /**
     * @return the 0-based column of the error, or {@code -1} if unknown
     */
    public int getColumn() {
        return column;
    }
}
