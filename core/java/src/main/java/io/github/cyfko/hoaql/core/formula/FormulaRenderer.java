package io.github.cyfko.hoaql.core.formula;

import io.github.cyfko.hoaql.core.config.HoaReservedSymbol;

import java.util.stream.Collectors;

/**
 * Renders formulas in the concrete syntax of HOA.
 * <ul>
 *   <li>atoms: {@code 3}, {@code Fin(0)}, {@code Inf(!2)}</li>
 *   <li>conjunction / disjunction: fully parenthesized, {@code (a & b & c)}, {@code (a | b)}</li>
 *   <li>negation: {@code (!a)}</li>
 *   <li>constants: {@code t}, {@code f}</li>
 *   <li>aliases: the bare name, {@code @a}</li>
 * </ul>
 * The output re-parses to an equal formula.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaRenderer {

    private static final AcceptanceVisitor<String> ACCEPTANCE = new AcceptanceVisitor<>() {
        @Override
        public String visitAnd(AcceptanceAnd and) {
            return and.operands().stream()
                    .map(operand -> operand.accept(this))
                    .collect(Collectors.joining(" " + HoaReservedSymbol.AND + " ", "(", ")"));
        }

        @Override
        public String visitOr(AcceptanceOr or) {
            return or.operands().stream()
                    .map(operand -> operand.accept(this))
                    .collect(Collectors.joining(" " + HoaReservedSymbol.OR + " ", "(", ")"));
        }

        @Override
        public String visitAtom(AcceptanceAtom atom) {
            return atom.type().keyword() + "(" + (atom.negated() ? HoaReservedSymbol.NOT : "") + atom.acceptanceSet() + ")";
        }

        @Override
        public String visitConstant(BooleanConstant constant) {
            return constant.symbol();
        }
    };

    private static final LabelVisitor<String> LABEL = new LabelVisitor<>() {
        @Override
        public String visitAnd(LabelAnd and) {
            return and.operands().stream()
                    .map(operand -> operand.accept(this))
                    .collect(Collectors.joining(" " + HoaReservedSymbol.AND + " ", "(", ")"));
        }

        @Override
        public String visitOr(LabelOr or) {
            return or.operands().stream()
                    .map(operand -> operand.accept(this))
                    .collect(Collectors.joining(" " + HoaReservedSymbol.OR + " ", "(", ")"));
        }

        @Override
        public String visitNot(LabelNot not) {
            return "(" + HoaReservedSymbol.NOT + not.operand().accept(this) + ")";
        }

        @Override
        public String visitAtom(LabelAtom atom) {
            return Integer.toString(atom.proposition());
        }

        @Override
        public String visitAlias(LabelAlias alias) {
            return alias.name().value();
        }

        @Override
        public String visitConstant(BooleanConstant constant) {
            return constant.symbol();
        }
    };

    private FormulaRenderer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Renders an acceptance condition, e.g. {@code (Fin(0) | (Fin(1) & Inf(!2)))}.
     */
    public static String renderAcceptance(AcceptanceCondition condition) {
        return condition.accept(ACCEPTANCE);
    }

    /**
     * Renders a label expression, e.g. {@code (!(0 | @a))}.
     */
    public static String renderLabel(LabelExpression expression) {
        return expression.accept(LABEL);
    }
}
