package io.github.cyfko.hoaql.core.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Validation exception context")
class HoaValidationExceptionTest {

    @Test
    @DisplayName("Should expose header and alias names")
    void testNames() {
        assertEquals("States:", new DuplicateHeaderException("States:").getHeaderName());
        assertEquals("Acceptance:", new MissingHeaderException("Acceptance:").getHeaderName());
        assertEquals("@a", new DuplicateAliasException("@a").getAlias());
        assertEquals("@b", new UndefinedAliasException("@b").getAlias());
        assertEquals("p", new DuplicatePropositionException("p").getProposition());
        assertEquals("@c", new UnresolvedAliasException("@c").getAlias());
    }

    @Test
    @DisplayName("Should expose counts")
    void testCounts() {
        PropositionCountException count = new PropositionCountException(3, 2);
        assertEquals(3, count.getDeclared());
        assertEquals(2, count.getActual());
        assertEquals("AP: declares 3 propositions but lists 2", count.getMessage());

        AcceptanceSetMismatchException mismatch = new AcceptanceSetMismatchException(2, Set.of(0));
        assertEquals(2, mismatch.getDeclared());
        assertEquals(List.of(0), List.copyOf(mismatch.getActual()));
        assertEquals("Acceptance: declares 2 sets but the condition uses [0]", mismatch.getMessage());

        assertEquals(4, new DuplicateStateException(4).getIndex());
    }

    @Test
    @DisplayName("Should describe undeclared indices")
    void testUndeclaredIndex() {
        UndeclaredIndexException e = new UndeclaredIndexException(UndeclaredIndexException.Kind.PROPOSITION, 5, 2);

        assertEquals(UndeclaredIndexException.Kind.PROPOSITION, e.getKind());
        assertEquals(5, e.getIndex());
        assertEquals(2, e.getBound());
        assertEquals("Undeclared atomic proposition 5 (declared: 2)", e.getMessage());
    }

    @Test
    @DisplayName("Should place every semantic error under HoaValidationException")
    void testHierarchy() {
        List<RuntimeException> errors = List.of(
                new DuplicateHeaderException("name:"),
                new MissingHeaderException("Acceptance:"),
                new DuplicateAliasException("@a"),
                new UndefinedAliasException("@a"),
                new PropositionCountException(1, 0),
                new DuplicatePropositionException("a"),
                new AcceptanceSetMismatchException(1, Set.of()),
                new DuplicateStateException(0),
                new UndeclaredIndexException(UndeclaredIndexException.Kind.STATE, 1, 1));

        errors.forEach(e -> assertInstanceOf(HoaValidationException.class, e));
        assertInstanceOf(IllegalArgumentException.class, new InvalidTokenException("identifier", ""));
        assertInstanceOf(IllegalStateException.class, new UnresolvedAliasException("@a"));
    }
}
