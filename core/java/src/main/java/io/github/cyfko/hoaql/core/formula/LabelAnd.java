package io.github.cyfko.hoaql.core.formula;

import java.util.List;

/**
 * Conjunction node of the label algebra.
 * <p>
 * Obtained through {@link LabelExpressions#and(java.util.Collection)}, never directly.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class LabelAnd extends AbstractMonotoneNode<LabelExpression> implements LabelExpression {

    LabelAnd(List<LabelExpression> operands) {
        super(operands);
    }

    @Override
    public <R> R accept(LabelVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }

    @Override
    public String toString() {
        return FormulaRenderer.renderLabel(this);
    }
}
