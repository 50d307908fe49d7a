package io.github.cyfko.hoaql.core.model;

import io.github.cyfko.hoaql.core.formula.LabelExpression;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * An edge line of the body, attached to the last declared state.
 *
 * <pre>{@code
 * [0 | 1] 2 & 3 {0}
 * }</pre>
 *
 * @param successors the target conjunction, at least one state (more for alternating automata)
 * @param label      the edge label, or {@code null}
 * @param accSig     the acceptance signature in ascending order, or {@code null}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Edge(List<Integer> successors, LabelExpression label, Set<Integer> accSig) {

    public Edge {
        successors = List.copyOf(successors);
        if (successors.isEmpty()) {
            throw new IllegalArgumentException("An edge needs at least one successor");
        }
        accSig = accSig == null ? null : Collections.unmodifiableSortedSet(new TreeSet<>(accSig));
    }

    /**
     * Unlabelled edge to a single state.
     */
    public static Edge to(int successor) {
        return new Edge(List.of(successor), null, null);
    }

    /**
     * Labelled edge to a single state.
     */
    public static Edge to(int successor, LabelExpression label) {
        return new Edge(List.of(successor), label, null);
    }
}
