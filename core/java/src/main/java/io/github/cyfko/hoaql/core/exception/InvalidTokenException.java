package io.github.cyfko.hoaql.core.exception;

/**
 * Thrown when a validated token type ({@link io.github.cyfko.hoaql.core.model.Identifier},
 * {@link io.github.cyfko.hoaql.core.model.AliasName}) is built from text that does not
 * match its lexical form.
 * <p>
 * This is a programming error on the construction side; the parser converts it into a
 * {@link HoaSyntaxException}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class InvalidTokenException extends IllegalArgumentException {

    private final String tokenType;
    private final String value;

    /**
     * @param tokenType name of the expected token form, e.g. {@code "identifier"}
     * @param value     the rejected text
     */
    public InvalidTokenException(String tokenType, String value) {
        super("Invalid " + tokenType + ": '" + value + "'");
        this.tokenType = tokenType;
        this.value = value;
    }

    public String getTokenType() {
        return tokenType;
    }

    public String getValue() {
        return value;
    }
}
