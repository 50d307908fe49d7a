package io.github.cyfko.hoaql.core.formula;

import java.util.List;

/**
 * Describes one monotone boolean operator (conjunction or disjunction) of a formula family.
 * <p>
 * {@link MonotoneSimplifier} is written once against this description and reused by both the
 * acceptance algebra and the label algebra, which only differ in their node classes.
 * </p>
 *
 * @param <F> the formula family the operator combines
 * @author Frank KOSSI
 * @since 1.0.0
 */
interface MonotoneOperator<F> {

    /**
     * The neutral element: {@code TRUE} for a conjunction, {@code FALSE} for a disjunction.
     */
    F identity();

    /**
     * The absorbing element: {@code FALSE} for a conjunction, {@code TRUE} for a disjunction.
     */
    F absorbing();

    /**
     * Returns the operands of {@code formula} when it is a node of this very operator.
     *
     * @param formula any formula of the family
     * @return the node operands, or {@code null} if {@code formula} is not a node of this operator
     */
    List<F> operandsOf(F formula);

    /**
     * Builds the node from an already simplified operand list (at least two distinct operands).
     */
    F create(List<F> operands);
}
