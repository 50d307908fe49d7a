package io.github.cyfko.hoaql.core.formula;

import java.util.List;

/**
 * Disjunction node of the acceptance algebra.
 * <p>
 * Obtained through {@link AcceptanceConditions#or(java.util.Collection)}, never directly.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AcceptanceOr extends AbstractMonotoneNode<AcceptanceCondition> implements AcceptanceCondition {

    AcceptanceOr(List<AcceptanceCondition> operands) {
        super(operands);
    }

    @Override
    public <R> R accept(AcceptanceVisitor<R> visitor) {
        return visitor.visitOr(this);
    }

    @Override
    public String toString() {
        return FormulaRenderer.renderAcceptance(this);
    }
}
