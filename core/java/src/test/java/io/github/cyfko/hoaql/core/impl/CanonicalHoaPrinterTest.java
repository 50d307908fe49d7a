package io.github.cyfko.hoaql.core.impl;

import io.github.cyfko.hoaql.core.formula.AcceptanceConditions;
import io.github.cyfko.hoaql.core.formula.BooleanConstant;
import io.github.cyfko.hoaql.core.formula.LabelAlias;
import io.github.cyfko.hoaql.core.formula.LabelExpressions;
import io.github.cyfko.hoaql.core.model.Acceptance;
import io.github.cyfko.hoaql.core.model.Automaton;
import io.github.cyfko.hoaql.core.model.Body;
import io.github.cyfko.hoaql.core.model.Edge;
import io.github.cyfko.hoaql.core.model.Header;
import io.github.cyfko.hoaql.core.model.HeaderValue;
import io.github.cyfko.hoaql.core.model.Identifier;
import io.github.cyfko.hoaql.core.model.State;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.github.cyfko.hoaql.core.formula.LabelExpressions.atom;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CanonicalHoaPrinter Tests")
class CanonicalHoaPrinterTest {

    private static final String FULL_DOCUMENT = """
            HOA: v1
            States: 3
            Start: 0
            Start: 1 & 2
            AP: 2 "a" "b"
            Alias: @both (0 & 1)
            Acceptance: 2 (Inf(0) & Fin(!1))
            acc-name: generalized-Buchi 2
            tool: "ltl2tgba" "2.9"
            name: "GFa"
            properties: trans-labels explicit-labels
            controllable-AP: 1
            --BODY--
            State: [0] 0 "init" {0}
            [@both] 1
            [(!0)] 0 & 1 {0 1}
            State: 1
            1
            State: 2
            --END--
            """;

    private CanonicalHoaPrinter printer;

    @BeforeEach
    void setUp() {
        printer = new CanonicalHoaPrinter();
    }

    private static Automaton fullAutomaton() {
        LabelAlias both = LabelExpressions.alias("@both", LabelExpressions.and(atom(0), atom(1)));
        Header header = Header.builder()
                .states(3)
                .startState(0)
                .startState(1, 2)
                .propositions(List.of("a", "b"))
                .alias(both)
                .acceptance(Acceptance.of(
                        AcceptanceConditions.and(AcceptanceConditions.inf(0), AcceptanceConditions.notFin(1)),
                        new Identifier("generalized-Buchi"), HeaderValue.of(2)))
                .tool("ltl2tgba", "2.9")
                .name("GFa")
                .property(new Identifier("trans-labels"))
                .property(new Identifier("explicit-labels"))
                .customHeader("controllable-AP", List.of(HeaderValue.of(1)))
                .build();

        Map<State, List<Edge>> edges = new LinkedHashMap<>();
        edges.put(new State(0, atom(0), "init", Set.of(0)), List.of(
                Edge.to(1, both),
                new Edge(List.of(0, 1), LabelExpressions.not(atom(0)), Set.of(1, 0))));
        edges.put(State.of(1), List.of(Edge.to(1)));
        edges.put(State.of(2), List.of());
        return new Automaton(header, new Body(edges));
    }

    @Test
    @DisplayName("Should print header items in canonical order")
    void testFullDocument() {
        assertEquals(FULL_DOCUMENT, printer.print(fullAutomaton()));
    }

    @Test
    @DisplayName("Should print the minimal document")
    void testMinimal() {
        Automaton automaton = new Automaton(
                Header.builder().acceptance(Acceptance.of(BooleanConstant.TRUE)).build(),
                Body.empty());

        assertEquals("HOA: v1\nAcceptance: 0 t\n--BODY--\n--END--\n", printer.print(automaton));
    }

    @Test
    @DisplayName("Should recompute the acceptance count from the condition")
    void testAcceptanceCount() {
        Automaton automaton = new Automaton(
                Header.builder().acceptance(Acceptance.of(AcceptanceConditions.or(
                        AcceptanceConditions.fin(0), AcceptanceConditions.inf(1), AcceptanceConditions.inf(0)))).build(),
                Body.empty());

        assertTrue(printer.print(automaton).contains("Acceptance: 2 (Fin(0) | Inf(1) | Inf(0))\n"));
    }

    @Test
    @DisplayName("Should print an explicitly empty signature")
    void testEmptyAccSig() {
        Map<State, List<Edge>> edges = new LinkedHashMap<>();
        edges.put(new State(0, null, null, Set.of()), List.of(new Edge(List.of(0), null, Set.of())));
        Automaton automaton = new Automaton(
                Header.builder().acceptance(Acceptance.of(BooleanConstant.FALSE)).build(), new Body(edges));

        assertTrue(printer.print(automaton).contains("State: 0 {}\n0 {}\n"));
    }

    @Test
    @DisplayName("Should round-trip through the parser")
    void testRoundTrip() {
        BasicHoaParser parser = new BasicHoaParser();

        Automaton parsed = parser.parse(FULL_DOCUMENT);

        assertEquals(fullAutomaton(), parsed);
        assertEquals(FULL_DOCUMENT, printer.print(parsed));
    }

    @Test
    @DisplayName("Should write the same text to an Appendable")
    void testAppendable() throws IOException {
        StringWriter writer = new StringWriter();

        printer.print(fullAutomaton(), writer);

        assertEquals(FULL_DOCUMENT, writer.toString());
    }
}
