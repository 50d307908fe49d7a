package io.github.cyfko.hoaql.core.formula;

import io.github.cyfko.hoaql.core.config.HoaReservedSymbol;

/**
 * The two boolean literals, shared by the acceptance and the label algebra.
 * <p>
 * They render as {@code t} and {@code f} in HOA documents. Negating a literal yields the
 * other literal, so a negation node never wraps a constant.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum BooleanConstant implements AcceptanceCondition, LabelExpression {

    /**
     * Tautology; identity of conjunction and absorbing element of disjunction.
     */
    TRUE(HoaReservedSymbol.TRUE),

    /**
     * Contradiction; identity of disjunction and absorbing element of conjunction.
     */
    FALSE(HoaReservedSymbol.FALSE);

    private final String symbol;

    BooleanConstant(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the constant matching a Java boolean.
     */
    public static BooleanConstant of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Returns the HOA token of this constant ({@code t} or {@code f}).
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Returns the other constant.
     */
    public BooleanConstant negate() {
        return this == TRUE ? FALSE : TRUE;
    }

    @Override
    public BooleanConstant not() {
        return negate();
    }

    @Override
    public <R> R accept(AcceptanceVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public <R> R accept(LabelVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
