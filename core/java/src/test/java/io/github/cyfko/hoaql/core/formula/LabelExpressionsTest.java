package io.github.cyfko.hoaql.core.formula;

import io.github.cyfko.hoaql.core.exception.InvalidTokenException;
import io.github.cyfko.hoaql.core.exception.UnresolvedAliasException;
import io.github.cyfko.hoaql.core.model.AliasName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.cyfko.hoaql.core.formula.LabelExpressions.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Label Algebra Tests")
class LabelExpressionsTest {

    private final LabelAtom a = atom(0);
    private final LabelAtom b = atom(1);
    private final LabelAtom c = atom(2);

    @Test
    @DisplayName("Should follow the same normalization rules as the acceptance algebra")
    void testNormalization() {
        assertSame(a, and(List.of(a)));
        assertSame(a, or(List.of(a)));
        assertEquals(BooleanConstant.TRUE, and(List.of()));
        assertEquals(BooleanConstant.FALSE, or(List.of()));
        assertEquals(BooleanConstant.FALSE, and(a, BooleanConstant.FALSE));
        assertEquals(BooleanConstant.TRUE, or(BooleanConstant.TRUE, a));

        LabelOr flattened = assertInstanceOf(LabelOr.class, or(a, or(b, a), c));
        assertEquals(List.of(a, b, c), flattened.operands());
    }

    @Test
    @DisplayName("Should flip constants instead of wrapping them")
    void testNotOnConstants() {
        assertEquals(BooleanConstant.FALSE, not(BooleanConstant.TRUE));
        assertEquals(BooleanConstant.TRUE, not(BooleanConstant.FALSE));
        assertEquals(BooleanConstant.FALSE, BooleanConstant.TRUE.not());
    }

    @Test
    @DisplayName("Should wrap other operands and keep double negation")
    void testNotWraps() {
        LabelNot negated = assertInstanceOf(LabelNot.class, not(a));
        assertEquals(a, negated.operand());

        LabelNot doubleNegated = assertInstanceOf(LabelNot.class, not(not(a)));
        assertEquals(not(a), doubleNegated.operand());
        assertEquals(not(a), a.not());
    }

    @Test
    @DisplayName("Should collect propositions through negations and aliases")
    void testPropositions() {
        LabelAlias alias = alias("@ab", and(a, b));
        LabelExpression expression = or(not(alias), atom(5), BooleanConstant.TRUE.not());

        assertEquals(List.of(0, 1, 5), List.copyOf(propositions(expression)));
        assertTrue(propositions(BooleanConstant.TRUE).isEmpty());
    }

    @Test
    @DisplayName("Should fail to look through an unresolved alias")
    void testUnresolvedAlias() {
        LabelAlias dangling = LabelAlias.unresolved(new AliasName("@x"));

        assertFalse(dangling.isResolved());
        assertTrue(dangling.resolved().isEmpty());
        UnresolvedAliasException e = assertThrows(UnresolvedAliasException.class,
                () -> propositions(and(a, dangling)));
        assertEquals("@x", e.getAlias());
    }

    @Test
    @DisplayName("Should compare aliases by name and expression")
    void testAliasEquality() {
        assertEquals(alias("@x", a), alias("@x", a));
        assertNotEquals(alias("@x", a), alias("@x", b));
        assertNotEquals(alias("@x", a), alias("@y", a));
        assertEquals(a, alias("@x", a).expression());
    }

    @Test
    @DisplayName("Should reject malformed alias names")
    void testInvalidAliasName() {
        assertThrows(InvalidTokenException.class, () -> alias("x", a));
        assertThrows(InvalidTokenException.class, () -> alias("@", a));
    }

    @Test
    @DisplayName("Should reject negative propositions")
    void testNegativeAtom() {
        assertThrows(IllegalArgumentException.class, () -> atom(-1));
    }
}
