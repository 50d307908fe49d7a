package io.github.cyfko.hoaql.core.formula;

/**
 * Exhaustive fold over the variants of {@link LabelExpression}.
 *
 * @param <R> the result type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface LabelVisitor<R> {

    R visitAnd(LabelAnd and);

    R visitOr(LabelOr or);

    R visitNot(LabelNot not);

    R visitAtom(LabelAtom atom);

    R visitAlias(LabelAlias alias);

    R visitConstant(BooleanConstant constant);
}
