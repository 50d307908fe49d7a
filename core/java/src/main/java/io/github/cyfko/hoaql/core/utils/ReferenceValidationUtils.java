package io.github.cyfko.hoaql.core.utils;

import io.github.cyfko.hoaql.core.exception.UndeclaredIndexException;
import io.github.cyfko.hoaql.core.exception.UndeclaredIndexException.Kind;
import io.github.cyfko.hoaql.core.formula.LabelAlias;
import io.github.cyfko.hoaql.core.formula.LabelExpression;
import io.github.cyfko.hoaql.core.formula.LabelExpressions;
import io.github.cyfko.hoaql.core.model.Automaton;
import io.github.cyfko.hoaql.core.model.Edge;
import io.github.cyfko.hoaql.core.model.Header;
import io.github.cyfko.hoaql.core.model.State;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Utility class checking that the indices used by an automaton stay within the bounds its
 * header declares.
 * <p>
 * The HOA format requires these bounds but many producers are careless about them, so the
 * check is opt-in through {@link io.github.cyfko.hoaql.core.config.HoaPolicy#validateReferences()}.
 * </p>
 *
 * <p><b>Checked references:</b></p>
 * <ul>
 *     <li>{@code Start:} states, {@code State:} indices and edge targets, against {@code States:}
 *         when it is declared</li>
 *     <li>propositions of every label and alias, against the {@code AP:} count (zero when absent)</li>
 *     <li>marks of every acceptance signature, against the {@code Acceptance:} count</li>
 * </ul>
 *
 * <p><b>Usage example:</b></p>
 * <pre>{@code
 * Automaton automaton = new BasicHoaParser().parse(text);
 * ReferenceValidationUtils.validateReferences(automaton); // throws UndeclaredIndexException
 * }</pre>
 *
 * <p>This class is stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ReferenceValidationUtils {

    /**
     * Private constructor to prevent instantiation.
     */
    private ReferenceValidationUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Validates every index of {@code automaton} against its header.
     *
     * @param automaton the automaton to check
     * @throws UndeclaredIndexException on the first index out of its bound
     */
    public static void validateReferences(Automaton automaton) {
        Header header = automaton.header();
        Integer states = header.states();
        int propositions = header.propositions().size();
        int acceptanceSets = header.acceptance().setCount();

        for (Set<Integer> conjunction : header.startStates()) {
            checkStates(conjunction, states);
        }
        for (LabelAlias alias : header.aliases()) {
            checkLabel(alias.expression(), propositions);
        }

        for (Map.Entry<State, List<Edge>> entry : automaton.body().edges().entrySet()) {
            State state = entry.getKey();
            checkStates(List.of(state.index()), states);
            checkLabel(state.label(), propositions);
            checkIndices(Kind.ACCEPTANCE_SET, state.accSig(), acceptanceSets);

            for (Edge edge : entry.getValue()) {
                checkStates(edge.successors(), states);
                checkLabel(edge.label(), propositions);
                checkIndices(Kind.ACCEPTANCE_SET, edge.accSig(), acceptanceSets);
            }
        }
    }

    private static void checkStates(Collection<Integer> indices, Integer declared) {
        if (declared != null) {
            checkIndices(Kind.STATE, indices, declared);
        }
    }

    private static void checkLabel(LabelExpression label, int declared) {
        if (label != null) {
            checkIndices(Kind.PROPOSITION, LabelExpressions.propositions(label), declared);
        }
    }

    /**
     * Checks that every index of {@code indices} is below {@code bound}; null collections pass.
     */
    public static void checkIndices(Kind kind, Collection<Integer> indices, int bound) {
        if (indices == null) {
            return;
        }
        for (int index : indices) {
            if (index >= bound) {
                throw new UndeclaredIndexException(kind, index, bound);
            }
        }
    }
}
