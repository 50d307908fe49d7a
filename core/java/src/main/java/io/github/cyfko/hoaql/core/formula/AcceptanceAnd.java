package io.github.cyfko.hoaql.core.formula;

import java.util.List;

/**
 * Conjunction node of the acceptance algebra.
 * <p>
 * Obtained through {@link AcceptanceConditions#and(java.util.Collection)}, never directly.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AcceptanceAnd extends AbstractMonotoneNode<AcceptanceCondition> implements AcceptanceCondition {

    AcceptanceAnd(List<AcceptanceCondition> operands) {
        super(operands);
    }

    @Override
    public <R> R accept(AcceptanceVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }

    @Override
    public String toString() {
        return FormulaRenderer.renderAcceptance(this);
    }
}
