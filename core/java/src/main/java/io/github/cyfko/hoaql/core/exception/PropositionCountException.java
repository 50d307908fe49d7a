package io.github.cyfko.hoaql.core.exception;

/**
 * Thrown when the count announced by {@code AP:} differs from the number of proposition
 * names that follow it.
 *
 * <pre>{@code
 * AP: 3 "a" "b"
 * // → "AP: declares 3 propositions but lists 2"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PropositionCountException extends HoaValidationException {

    private final int declared;
    private final int actual;

    public PropositionCountException(int declared, int actual) {
        super("AP: declares " + declared + " propositions but lists " + actual);
        this.declared = declared;
        this.actual = actual;
    }

    public int getDeclared() {
        return declared;
    }

    public int getActual() {
        return actual;
    }
}
