package io.github.cyfko.hoaql.core.exception;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Thrown when the acceptance sets used by the {@code Acceptance:} condition are not exactly
 * {@code {0, ..., n-1}} for the announced count {@code n}.
 *
 * <pre>{@code
 * Acceptance: 2 Inf(0)
 * // → "Acceptance: declares 2 sets but the condition uses [0]"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class AcceptanceSetMismatchException extends HoaValidationException {

    private final int declared;
    private final SortedSet<Integer> actual;

    /**
     * @param declared the count announced by the header
     * @param actual   the acceptance sets the condition actually references
     */
    public AcceptanceSetMismatchException(int declared, Set<Integer> actual) {
        super("Acceptance: declares " + declared + " sets but the condition uses " + new TreeSet<>(actual));
        this.declared = declared;
        this.actual = Collections.unmodifiableSortedSet(new TreeSet<>(actual));
    }

    public int getDeclared() {
        return declared;
    }

    public SortedSet<Integer> getActual() {
        return actual;
    }
}
