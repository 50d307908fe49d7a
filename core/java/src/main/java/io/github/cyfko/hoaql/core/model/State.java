package io.github.cyfko.hoaql.core.model;

import io.github.cyfko.hoaql.core.formula.LabelExpression;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * A {@code State:} line of the body.
 *
 * <pre>{@code
 * State: [0 & !1] 3 "accepting sink" {0 1}
 * }</pre>
 *
 * @param index  the state number
 * @param label  the state label, or {@code null}
 * @param name   the state name without its quotes, or {@code null}; escapes are kept as written
 * @param accSig the acceptance signature in ascending order, or {@code null} when the line has
 *               none; an empty set stands for a literal {@code {}}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record State(int index, LabelExpression label, String name, Set<Integer> accSig) implements Comparable<State> {

    public State {
        if (index < 0) {
            throw new IllegalArgumentException("State index must be non-negative, got: " + index);
        }
        QuotedStrings.check(name);
        accSig = accSig == null ? null : Collections.unmodifiableSortedSet(new TreeSet<>(accSig));
    }

    /**
     * A bare state with no label, name or signature.
     */
    public static State of(int index) {
        return new State(index, null, null, null);
    }

    @Override
    public int compareTo(State other) {
        return Integer.compare(index, other.index);
    }
}
