package io.github.cyfko.hoaql.core.exception;

/**
 * Thrown when two {@code State:} lines in the body carry the same index.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DuplicateStateException extends HoaValidationException {

    private final int index;

    public DuplicateStateException(int index) {
        super("State " + index + " is declared more than once");
        this.index = index;
    }

    public int getIndex() {
        return index;
    }
}
