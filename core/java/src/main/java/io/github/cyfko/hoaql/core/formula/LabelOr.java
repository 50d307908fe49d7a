package io.github.cyfko.hoaql.core.formula;

import java.util.List;

/**
 * Disjunction node of the label algebra.
 * <p>
 * Obtained through {@link LabelExpressions#or(java.util.Collection)}, never directly.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class LabelOr extends AbstractMonotoneNode<LabelExpression> implements LabelExpression {

    LabelOr(List<LabelExpression> operands) {
        super(operands);
    }

    @Override
    public <R> R accept(LabelVisitor<R> visitor) {
        return visitor.visitOr(this);
    }

    @Override
    public String toString() {
        return FormulaRenderer.renderLabel(this);
    }
}
