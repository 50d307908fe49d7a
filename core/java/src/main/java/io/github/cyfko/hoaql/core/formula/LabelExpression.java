package io.github.cyfko.hoaql.core.formula;

/**
 * A formula of the label algebra of HOA: proposition indices and aliases combined with
 * conjunction, disjunction and negation.
 * <p>
 * Labels guard states and edges ({@code [0 & !1]}) and give a meaning to {@code Alias:} header
 * items. The hierarchy is closed; folds are written as {@link LabelVisitor}s.
 * </p>
 *
 * <pre>{@code
 * LabelExpression guard = LabelExpressions.atom(0).and(LabelExpressions.atom(1).not());
 * guard.toString();  // "(0 & (!1))"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see LabelExpressions
 */
public sealed interface LabelExpression
        permits LabelAnd, LabelOr, LabelNot, LabelAtom, LabelAlias, BooleanConstant {

    /**
     * Dispatches to the visitor method matching the concrete variant.
     *
     * @param visitor the fold to apply
     * @param <R>     the fold result type
     * @return the visitor's result
     */
    <R> R accept(LabelVisitor<R> visitor);

    /**
     * Creates the simplified conjunction of this expression and {@code other}.
     */
    default LabelExpression and(LabelExpression other) {
        return LabelExpressions.and(this, other);
    }

    /**
     * Creates the simplified disjunction of this expression and {@code other}.
     */
    default LabelExpression or(LabelExpression other) {
        return LabelExpressions.or(this, other);
    }

    /**
     * Creates the negation of this expression; constants are flipped instead of wrapped.
     */
    default LabelExpression not() {
        return LabelExpressions.not(this);
    }
}
