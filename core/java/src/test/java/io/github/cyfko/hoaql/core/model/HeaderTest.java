package io.github.cyfko.hoaql.core.model;

import io.github.cyfko.hoaql.core.exception.InvalidTokenException;
import io.github.cyfko.hoaql.core.formula.AcceptanceConditions;
import io.github.cyfko.hoaql.core.formula.BooleanConstant;
import io.github.cyfko.hoaql.core.formula.LabelExpressions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Header Tests")
class HeaderTest {

    private Header.Builder builder;

    @BeforeEach
    void setUp() {
        builder = Header.builder().acceptance(Acceptance.of(AcceptanceConditions.inf(0)));
    }

    @Test
    @DisplayName("Should default to format v1 and empty collections")
    void testDefaults() {
        Header header = builder.build();

        assertEquals(new Identifier(Header.DEFAULT_VERSION), header.formatVersion());
        assertNull(header.states());
        assertTrue(header.startStates().isEmpty());
        assertTrue(header.propositions().isEmpty());
        assertTrue(header.aliases().isEmpty());
        assertTrue(header.tool().isEmpty());
        assertNull(header.name());
        assertTrue(header.properties().isEmpty());
        assertTrue(header.customHeaders().isEmpty());
    }

    @Test
    @DisplayName("Should accumulate repeated items in call order")
    void testAccumulation() {
        // When
        Header header = builder
                .startState(0)
                .startState(2, 1)
                .alias(LabelExpressions.alias("@a", LabelExpressions.atom(0)))
                .alias(LabelExpressions.alias("@b", BooleanConstant.TRUE))
                .property(new Identifier("deterministic"))
                .properties(List.of(new Identifier("complete")))
                .customHeader("first", List.of(HeaderValue.of(1)))
                .customHeader("second", List.of())
                .build();

        // Then
        assertEquals(List.of(Set.of(0), Set.of(1, 2)), new ArrayList<>(header.startStates()));
        assertEquals(List.of(2, 1), new ArrayList<>(List.copyOf(header.startStates()).get(1)));
        assertEquals(List.of("@a", "@b"), header.aliases().stream().map(a -> a.name().value()).toList());
        assertEquals(List.of("deterministic", "complete"), header.properties().stream().map(Identifier::value).toList());
        assertEquals(List.of("first", "second"), new ArrayList<>(header.customHeaders().keySet()));
    }

    @Test
    @DisplayName("Should require an acceptance")
    void testMissingAcceptance() {
        assertThrows(NullPointerException.class, () -> Header.builder().build());
    }

    @Test
    @DisplayName("Should reject inconsistent values")
    void testInvalid() {
        assertThrows(IllegalArgumentException.class, () -> builder.states(-1).build());
        assertThrows(IllegalArgumentException.class, () -> Header.builder()
                .acceptance(Acceptance.of(BooleanConstant.TRUE))
                .startStates(List.of())
                .build());
    }

    @Test
    @DisplayName("Should expose unmodifiable copies")
    void testImmutability() {
        List<String> propositions = new ArrayList<>(List.of("a"));
        Header header = builder.propositions(propositions).tool("spot", "2.9").build();
        propositions.add("b");

        assertEquals(List.of("a"), header.propositions());
        assertEquals(List.of("spot", "2.9"), header.tool());
        assertThrows(UnsupportedOperationException.class, () -> header.propositions().add("c"));
        assertThrows(UnsupportedOperationException.class, () -> header.customHeaders().put("x", List.of()));
        assertThrows(UnsupportedOperationException.class, () -> header.startStates().clear());
    }

    @Test
    @DisplayName("Should reject acc-name parameters that are strings or lack a name")
    void testAcceptanceParameters() {
        assertThrows(IllegalArgumentException.class, () -> Acceptance.of(
                AcceptanceConditions.inf(0), new Identifier("Buchi"), HeaderValue.string("x")));
        assertThrows(IllegalArgumentException.class, () -> new Acceptance(
                AcceptanceConditions.inf(0), null, List.of(HeaderValue.of(1))));

        Acceptance acceptance = Acceptance.of(
                AcceptanceConditions.and(AcceptanceConditions.inf(0), AcceptanceConditions.inf(1)),
                new Identifier("generalized-Buchi"), HeaderValue.of(2));
        assertEquals(2, acceptance.setCount());
        assertEquals(Map.of(), Header.builder().acceptance(acceptance).build().customHeaders());
    }

    @ParameterizedTest
    @ValueSource(strings = {"x\"y", "trailing\\", "\"", "a\\\\\"b"})
    @DisplayName("Should reject quoted text that would not print as one HOA string")
    void testUnprintableStrings(String text) {
        assertThrows(InvalidTokenException.class, () -> builder.name(text).build());
        assertThrows(InvalidTokenException.class, () -> builder.name(null).tool(text).build());
        assertThrows(InvalidTokenException.class, () -> builder.tool("ok", text).build());
        assertThrows(InvalidTokenException.class, () -> Header.builder()
                .acceptance(Acceptance.of(AcceptanceConditions.inf(0)))
                .propositions(List.of("a", text))
                .build());
        assertThrows(InvalidTokenException.class, () -> new State(0, null, text, null));
    }

    @Test
    @DisplayName("Should keep escape sequences in quoted text as written")
    void testEscapedStrings() {
        Header header = builder.name("say \\\"hi\\\"").tool("a\\\\b").propositions(List.of("\\n")).build();

        assertEquals("say \\\"hi\\\"", header.name());
        assertEquals(List.of("a\\\\b"), header.tool());
        assertEquals("x\\\"y", new State(0, null, "x\\\"y", null).name());
    }
}
