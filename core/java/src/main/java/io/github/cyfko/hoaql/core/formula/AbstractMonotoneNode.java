package io.github.cyfko.hoaql.core.formula;

import java.util.List;

/**
 * Common state of the conjunction and disjunction nodes of both algebras.
 * <p>
 * Nodes are only created by {@link MonotoneSimplifier}, so the operand list is always
 * normalized: at least two distinct operands, no direct child of the same operator and
 * neither constant among them. Equality is structural and operand order is significant.
 * </p>
 *
 * @param <F> the formula family
 */
abstract class AbstractMonotoneNode<F> {

    private final List<F> operands;

    AbstractMonotoneNode(List<F> operands) {
        this.operands = List.copyOf(operands);
    }

    /**
     * Returns the operands in stored order.
     *
     * @return an unmodifiable list of at least two operands
     */
    public List<F> operands() {
        return operands;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return operands.equals(((AbstractMonotoneNode<?>) o).operands);
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + operands.hashCode();
    }
}
