package io.github.cyfko.hoaql.core.formula;

/**
 * Reference to an atomic proposition by its position in the {@code AP:} header.
 *
 * @param proposition zero-based proposition index
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record LabelAtom(int proposition) implements LabelExpression {

    public LabelAtom {
        if (proposition < 0) {
            throw new IllegalArgumentException("Proposition index must be non-negative, got: " + proposition);
        }
    }

    @Override
    public <R> R accept(LabelVisitor<R> visitor) {
        return visitor.visitAtom(this);
    }

    @Override
    public String toString() {
        return FormulaRenderer.renderLabel(this);
    }
}
