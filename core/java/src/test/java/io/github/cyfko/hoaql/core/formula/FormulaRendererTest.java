package io.github.cyfko.hoaql.core.formula;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormulaRenderer Tests")
class FormulaRendererTest {

    @Test
    @DisplayName("Should render acceptance formulas fully parenthesized")
    void testAcceptance() {
        AcceptanceCondition condition = AcceptanceConditions.or(
                AcceptanceConditions.and(AcceptanceConditions.notFin(2), AcceptanceConditions.inf(0)),
                AcceptanceConditions.inf(1));

        assertEquals("((Fin(!2) & Inf(0)) | Inf(1))", FormulaRenderer.renderAcceptance(condition));
        assertEquals("Inf(3)", AcceptanceConditions.inf(3).toString());
        assertEquals("t", FormulaRenderer.renderAcceptance(BooleanConstant.TRUE));
    }

    @Test
    @DisplayName("Should render labels with negation in parentheses and aliases by name")
    void testLabel() {
        LabelExpression label = LabelExpressions.and(
                LabelExpressions.not(LabelExpressions.atom(0)),
                LabelExpressions.or(LabelExpressions.atom(1), LabelExpressions.alias("@go", BooleanConstant.TRUE)));

        assertEquals("((!0) & (1 | @go))", FormulaRenderer.renderLabel(label));
        assertEquals("3", LabelExpressions.atom(3).toString());
        assertEquals("f", FormulaRenderer.renderLabel(BooleanConstant.FALSE));
    }
}
