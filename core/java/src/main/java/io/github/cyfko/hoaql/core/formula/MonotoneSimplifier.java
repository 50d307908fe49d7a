package io.github.cyfko.hoaql.core.formula;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Smart-constructor algorithm shared by every conjunction and disjunction of the library.
 * <p>
 * Whatever operands are supplied, the returned value honours the normal form of the algebra:
 * </p>
 * <ul>
 *   <li>Idempotence: {@code A & A → A}, {@code A | A → A}</li>
 *   <li>Empty operand list: {@code &() → t}, {@code |() → f}</li>
 *   <li>Annihilation: {@code A & f → f}, {@code A | t → t}</li>
 *   <li>Single operand: {@code &(A) → A} (no node with fewer than two operands)</li>
 *   <li>Associativity: {@code (A & B) & C → A & B & C}, spliced in left-to-right depth-first order</li>
 * </ul>
 *
 * <p>This class is designed to be used statically and cannot be instantiated.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see AcceptanceConditions
 * @see LabelExpressions
 */
final class MonotoneSimplifier {

    private MonotoneSimplifier() {}

    /**
     * Combines {@code operands} with {@code operator}, returning the simplest equivalent formula.
     *
     * @param operands the operands, in order; {@code null} elements are rejected
     * @param operator the operator description
     * @param <F>      the formula family
     * @return the identity, the absorbing element, a single operand, or a normalized node
     * @throws NullPointerException if the collection or one of its elements is {@code null}
     */
    static <F> F simplify(Collection<? extends F> operands, MonotoneOperator<F> operator) {
        Objects.requireNonNull(operands, "operands cannot be null");
        Objects.requireNonNull(operator, "operator cannot be null");

        Set<F> unique = new LinkedHashSet<>();
        for (F operand : operands) {
            unique.add(Objects.requireNonNull(operand, "operands cannot contain null"));
        }

        if (unique.isEmpty()) {
            return operator.identity();
        }
        if (unique.size() == 1) {
            return unique.iterator().next();
        }
        if (unique.contains(operator.absorbing())) {
            return operator.absorbing();
        }

        // shift up sub-formulas of the same operator; a second pass over the set removes
        // operands that only became duplicates once spliced in
        Set<F> flattened = new LinkedHashSet<>();
        for (F operand : unique) {
            flatten(operand, operator, flattened);
        }

        if (flattened.size() == 1) {
            return flattened.iterator().next();
        }
        return operator.create(List.copyOf(flattened));
    }

    private static <F> void flatten(F formula, MonotoneOperator<F> operator, Set<F> out) {
        List<F> nested = operator.operandsOf(formula);
        if (nested == null) {
            out.add(formula);
            return;
        }
        for (F child : nested) {
            flatten(child, operator, out);
        }
    }
}
