package io.github.cyfko.hoaql.core.formula;

import java.util.Objects;

/**
 * Acceptance atom {@code Fin(n)}, {@code Inf(n)}, {@code Fin(!n)} or {@code Inf(!n)}.
 * <p>
 * The negation flag is the only form of negation of the acceptance algebra.
 * </p>
 *
 * @param type          {@code Fin} or {@code Inf}
 * @param acceptanceSet index of the acceptance mark, non-negative
 * @param negated       whether the mark is complemented ({@code !n})
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record AcceptanceAtom(AtomType type, int acceptanceSet, boolean negated) implements AcceptanceCondition {

    public AcceptanceAtom {
        Objects.requireNonNull(type, "Atom type is required");
        if (acceptanceSet < 0) {
            throw new IllegalArgumentException("Acceptance set must be non-negative, got: " + acceptanceSet);
        }
    }

    /**
     * Returns the same atom with its negation flag toggled.
     */
    public AcceptanceAtom negate() {
        return new AcceptanceAtom(type, acceptanceSet, !negated);
    }

    @Override
    public <R> R accept(AcceptanceVisitor<R> visitor) {
        return visitor.visitAtom(this);
    }

    @Override
    public String toString() {
        return FormulaRenderer.renderAcceptance(this);
    }
}
