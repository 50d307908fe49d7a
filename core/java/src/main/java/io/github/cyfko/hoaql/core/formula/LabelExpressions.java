package io.github.cyfko.hoaql.core.formula;

import io.github.cyfko.hoaql.core.exception.UnresolvedAliasException;
import io.github.cyfko.hoaql.core.model.AliasName;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Smart constructors and folds of the label algebra.
 * <p>
 * Conjunctions and disjunctions are normalized exactly as in the acceptance algebra (see
 * {@link AcceptanceConditions}); in addition {@link #not(LabelExpression)} flips constants
 * instead of wrapping them.
 * </p>
 *
 * <p><b>Usage example:</b></p>
 * <pre>{@code
 * LabelExpression a = LabelExpressions.atom(0);
 * LabelExpression b = LabelExpressions.atom(1);
 * LabelExpressions.and(a, LabelExpressions.and(b, a));  // (0 & 1)
 * LabelExpressions.not(BooleanConstant.TRUE);            // f
 * LabelExpressions.propositions(a.or(b.not()));          // [0, 1]
 * }</pre>
 *
 * <p>This class is stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class LabelExpressions {

    private static final MonotoneOperator<LabelExpression> AND = new MonotoneOperator<>() {
        @Override
        public LabelExpression identity() {
            return BooleanConstant.TRUE;
        }

        @Override
        public LabelExpression absorbing() {
            return BooleanConstant.FALSE;
        }

        @Override
        public List<LabelExpression> operandsOf(LabelExpression formula) {
            return formula instanceof LabelAnd ? ((LabelAnd) formula).operands() : null;
        }

        @Override
        public LabelExpression create(List<LabelExpression> operands) {
            return new LabelAnd(operands);
        }
    };

    private static final MonotoneOperator<LabelExpression> OR = new MonotoneOperator<>() {
        @Override
        public LabelExpression identity() {
            return BooleanConstant.FALSE;
        }

        @Override
        public LabelExpression absorbing() {
            return BooleanConstant.TRUE;
        }

        @Override
        public List<LabelExpression> operandsOf(LabelExpression formula) {
            return formula instanceof LabelOr ? ((LabelOr) formula).operands() : null;
        }

        @Override
        public LabelExpression create(List<LabelExpression> operands) {
            return new LabelOr(operands);
        }
    };

    private LabelExpressions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Simplified conjunction of the given expressions; an empty collection yields {@code t}.
     */
    public static LabelExpression and(Collection<? extends LabelExpression> operands) {
        return MonotoneSimplifier.simplify(operands, AND);
    }

    /**
     * Varargs form of {@link #and(Collection)}.
     */
    public static LabelExpression and(LabelExpression... operands) {
        return and(Arrays.asList(operands));
    }

    /**
     * Simplified disjunction of the given expressions; an empty collection yields {@code f}.
     */
    public static LabelExpression or(Collection<? extends LabelExpression> operands) {
        return MonotoneSimplifier.simplify(operands, OR);
    }

    /**
     * Varargs form of {@link #or(Collection)}.
     */
    public static LabelExpression or(LabelExpression... operands) {
        return or(Arrays.asList(operands));
    }

    /**
     * Negation of {@code operand}.
     * <p>
     * {@code !t} is {@code f} and {@code !f} is {@code t}; any other operand is wrapped in a
     * {@link LabelNot}. Double negations are kept as written.
     * </p>
     *
     * @param operand the expression to negate
     * @return the negated expression
     */
    public static LabelExpression not(LabelExpression operand) {
        if (operand instanceof BooleanConstant) {
            return ((BooleanConstant) operand).negate();
        }
        return new LabelNot(operand);
    }

    /**
     * Atom referencing proposition {@code proposition}.
     */
    public static LabelAtom atom(int proposition) {
        return new LabelAtom(proposition);
    }

    /**
     * Alias {@code name} bound to {@code expression}.
     */
    public static LabelAlias alias(String name, LabelExpression expression) {
        return LabelAlias.of(new AliasName(name), expression);
    }

    /**
     * Collects the proposition indices referenced anywhere in {@code expression}, looking
     * through aliases.
     *
     * @param expression the expression to inspect
     * @return an unmodifiable, ascending set of proposition indices
     * @throws UnresolvedAliasException if a dangling alias is reached
     */
    public static SortedSet<Integer> propositions(LabelExpression expression) {
        SortedSet<Integer> propositions = new TreeSet<>();
        expression.accept(new LabelVisitor<Void>() {
            @Override
            public Void visitAnd(LabelAnd and) {
                and.operands().forEach(operand -> operand.accept(this));
                return null;
            }

            @Override
            public Void visitOr(LabelOr or) {
                or.operands().forEach(operand -> operand.accept(this));
                return null;
            }

            @Override
            public Void visitNot(LabelNot not) {
                return not.operand().accept(this);
            }

            @Override
            public Void visitAtom(LabelAtom atom) {
                propositions.add(atom.proposition());
                return null;
            }

            @Override
            public Void visitAlias(LabelAlias alias) {
                return alias.expression().accept(this);
            }

            @Override
            public Void visitConstant(BooleanConstant constant) {
                return null;
            }
        });
        return Collections.unmodifiableSortedSet(propositions);
    }
}
