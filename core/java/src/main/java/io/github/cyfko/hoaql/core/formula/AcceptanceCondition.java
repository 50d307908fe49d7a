package io.github.cyfko.hoaql.core.formula;

/**
 * A formula of the positive acceptance algebra of HOA: {@code Fin}/{@code Inf} atoms combined
 * with conjunction and disjunction only.
 * <p>
 * There is no negation node in this algebra; negation lives inside {@link AcceptanceAtom}
 * ({@code Fin(!0)}). The hierarchy is closed, so every fold written as an
 * {@link AcceptanceVisitor} is checked for exhaustiveness by the compiler.
 * </p>
 *
 * <h2>Core Concepts</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> every operation returns a new value</li>
 *   <li><strong>Normal form:</strong> conjunctions and disjunctions are simplified on construction
 *       (see {@link AcceptanceConditions#and(java.util.Collection)})</li>
 *   <li><strong>Value semantics:</strong> structurally equal conditions are {@code equals}</li>
 * </ul>
 *
 * <pre>{@code
 * AcceptanceCondition rabin = AcceptanceConditions.fin(0).and(AcceptanceConditions.inf(1));
 * rabin.toString();  // "(Fin(0) & Inf(1))"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see AcceptanceConditions
 */
public sealed interface AcceptanceCondition
        permits AcceptanceAnd, AcceptanceOr, AcceptanceAtom, BooleanConstant {

    /**
     * Dispatches to the visitor method matching the concrete variant.
     *
     * @param visitor the fold to apply
     * @param <R>     the fold result type
     * @return the visitor's result
     */
    <R> R accept(AcceptanceVisitor<R> visitor);

    /**
     * Creates the simplified conjunction of this condition and {@code other}.
     *
     * @param other the right operand
     * @return {@code this & other}, in normal form
     */
    default AcceptanceCondition and(AcceptanceCondition other) {
        return AcceptanceConditions.and(this, other);
    }

    /**
     * Creates the simplified disjunction of this condition and {@code other}.
     *
     * @param other the right operand
     * @return {@code this | other}, in normal form
     */
    default AcceptanceCondition or(AcceptanceCondition other) {
        return AcceptanceConditions.or(this, other);
    }
}
