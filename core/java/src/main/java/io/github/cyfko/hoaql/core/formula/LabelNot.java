package io.github.cyfko.hoaql.core.formula;

/**
 * Negation node of the label algebra.
 * <p>
 * Obtained through {@link LabelExpressions#not(LabelExpression)}; never wraps a
 * {@link BooleanConstant}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class LabelNot implements LabelExpression {

    private final LabelExpression operand;

    LabelNot(LabelExpression operand) {
        this.operand = operand;
    }

    /**
     * Returns the negated expression.
     */
    public LabelExpression operand() {
        return operand;
    }

    @Override
    public <R> R accept(LabelVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LabelNot)) return false;
        return operand.equals(((LabelNot) o).operand);
    }

    @Override
    public int hashCode() {
        return 31 * LabelNot.class.hashCode() + operand.hashCode();
    }

    @Override
    public String toString() {
        return FormulaRenderer.renderLabel(this);
    }
}
