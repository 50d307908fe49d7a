package io.github.cyfko.hoaql.core.formula;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Smart constructors and folds of the acceptance algebra.
 * <p>
 * {@link #and(Collection)} and {@link #or(Collection)} are the only way to obtain conjunction
 * and disjunction nodes; they always return a formula in normal form, which may be a constant
 * or one of the operands rather than a new node.
 * </p>
 *
 * <p><b>Usage example:</b></p>
 * <pre>{@code
 * AcceptanceCondition c = AcceptanceConditions.or(
 *         AcceptanceConditions.and(fin(0), inf(1)),
 *         inf(2));
 * AcceptanceConditions.acceptingSets(c);      // [0, 1, 2]
 * AcceptanceConditions.countAcceptingSets(c); // 3
 * }</pre>
 *
 * <p>This class is stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AcceptanceConditions {

    private static final MonotoneOperator<AcceptanceCondition> AND = new MonotoneOperator<>() {
        @Override
        public AcceptanceCondition identity() {
            return BooleanConstant.TRUE;
        }

        @Override
        public AcceptanceCondition absorbing() {
            return BooleanConstant.FALSE;
        }

        @Override
        public List<AcceptanceCondition> operandsOf(AcceptanceCondition formula) {
            return formula instanceof AcceptanceAnd ? ((AcceptanceAnd) formula).operands() : null;
        }

        @Override
        public AcceptanceCondition create(List<AcceptanceCondition> operands) {
            return new AcceptanceAnd(operands);
        }
    };

    private static final MonotoneOperator<AcceptanceCondition> OR = new MonotoneOperator<>() {
        @Override
        public AcceptanceCondition identity() {
            return BooleanConstant.FALSE;
        }

        @Override
        public AcceptanceCondition absorbing() {
            return BooleanConstant.TRUE;
        }

        @Override
        public List<AcceptanceCondition> operandsOf(AcceptanceCondition formula) {
            return formula instanceof AcceptanceOr ? ((AcceptanceOr) formula).operands() : null;
        }

        @Override
        public AcceptanceCondition create(List<AcceptanceCondition> operands) {
            return new AcceptanceOr(operands);
        }
    };

    private AcceptanceConditions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Simplified conjunction of the given conditions; an empty collection yields {@code t}.
     *
     * @param operands the conjuncts, in order
     * @return the normalized conjunction
     */
    public static AcceptanceCondition and(Collection<? extends AcceptanceCondition> operands) {
        return MonotoneSimplifier.simplify(operands, AND);
    }

    /**
     * Varargs form of {@link #and(Collection)}.
     */
    public static AcceptanceCondition and(AcceptanceCondition... operands) {
        return and(Arrays.asList(operands));
    }

    /**
     * Simplified disjunction of the given conditions; an empty collection yields {@code f}.
     *
     * @param operands the disjuncts, in order
     * @return the normalized disjunction
     */
    public static AcceptanceCondition or(Collection<? extends AcceptanceCondition> operands) {
        return MonotoneSimplifier.simplify(operands, OR);
    }

    /**
     * Varargs form of {@link #or(Collection)}.
     */
    public static AcceptanceCondition or(AcceptanceCondition... operands) {
        return or(Arrays.asList(operands));
    }

    /** {@code Fin(set)} */
    public static AcceptanceAtom fin(int acceptanceSet) {
        return new AcceptanceAtom(AtomType.FIN, acceptanceSet, false);
    }

    /** {@code Fin(!set)} */
    public static AcceptanceAtom notFin(int acceptanceSet) {
        return fin(acceptanceSet).negate();
    }

    /** {@code Inf(set)} */
    public static AcceptanceAtom inf(int acceptanceSet) {
        return new AcceptanceAtom(AtomType.INF, acceptanceSet, false);
    }

    /** {@code Inf(!set)} */
    public static AcceptanceAtom notInf(int acceptanceSet) {
        return inf(acceptanceSet).negate();
    }

    /**
     * Collects the acceptance marks referenced anywhere in {@code condition}.
     * <p>
     * Atoms contribute their set index regardless of negation; constants contribute nothing.
     * </p>
     *
     * @param condition the condition to inspect
     * @return an unmodifiable, ascending set of mark indices
     */
    public static SortedSet<Integer> acceptingSets(AcceptanceCondition condition) {
        SortedSet<Integer> sets = new TreeSet<>();
        condition.accept(new AcceptanceVisitor<Void>() {
            @Override
            public Void visitAnd(AcceptanceAnd and) {
                and.operands().forEach(operand -> operand.accept(this));
                return null;
            }

            @Override
            public Void visitOr(AcceptanceOr or) {
                or.operands().forEach(operand -> operand.accept(this));
                return null;
            }

            @Override
            public Void visitAtom(AcceptanceAtom atom) {
                sets.add(atom.acceptanceSet());
                return null;
            }

            @Override
            public Void visitConstant(BooleanConstant constant) {
                return null;
            }
        });
        return Collections.unmodifiableSortedSet(sets);
    }

    /**
     * Number of distinct acceptance marks referenced by {@code condition}.
     */
    public static int countAcceptingSets(AcceptanceCondition condition) {
        return acceptingSets(condition).size();
    }
}
