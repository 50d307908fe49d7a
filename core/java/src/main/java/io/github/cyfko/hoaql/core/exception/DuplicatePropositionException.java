package io.github.cyfko.hoaql.core.exception;

/**
 * Thrown when {@code AP:} lists the same proposition name twice.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DuplicatePropositionException extends HoaValidationException {

    private final String proposition;

    /**
     * @param proposition the repeated proposition name, without quotes
     */
    public DuplicatePropositionException(String proposition) {
        super("Atomic proposition \"" + proposition + "\" is declared more than once");
        this.proposition = proposition;
    }

    public String getProposition() {
        return proposition;
    }
}
