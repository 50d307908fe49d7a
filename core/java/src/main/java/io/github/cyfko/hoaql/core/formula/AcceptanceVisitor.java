package io.github.cyfko.hoaql.core.formula;

/**
 * Exhaustive fold over the variants of {@link AcceptanceCondition}.
 *
 * @param <R> the result type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface AcceptanceVisitor<R> {

    R visitAnd(AcceptanceAnd and);

    R visitOr(AcceptanceOr or);

    R visitAtom(AcceptanceAtom atom);

    R visitConstant(BooleanConstant constant);
}
