package io.github.cyfko.hoaql.core;

import io.github.cyfko.hoaql.core.exception.HoaParseException;
import io.github.cyfko.hoaql.core.model.Automaton;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.io.UncheckedIOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("HoaFormat Tests")
class HoaFormatTest {

    private static final String DOCUMENT = """
            HOA: v1
            States: 1
            Start: 0
            AP: 1 "a"
            Acceptance: 1 Inf(0)
            --BODY--
            State: 0
            [0] 0 {0}
            --END--
            """;

    @Mock
    private Appendable failingSink;

    @BeforeEach
    void setUp() throws IOException {
        MockitoAnnotations.openMocks(this);
        when(failingSink.append(any(CharSequence.class))).thenThrow(new IOException("disk full"));
        when(failingSink.append(anyChar())).thenThrow(new IOException("disk full"));
    }

    @Test
    @DisplayName("Should parse and print with the default components")
    void testParsePrint() {
        Automaton automaton = HoaFormat.parse(DOCUMENT);

        assertEquals(DOCUMENT, HoaFormat.print(automaton));
        assertEquals(automaton, HoaFormat.parse(HoaFormat.print(automaton)));
    }

    @Test
    @DisplayName("Should dump into an Appendable")
    void testDump() {
        StringBuilder out = new StringBuilder();

        HoaFormat.dump(HoaFormat.parse(DOCUMENT), out);

        assertEquals(DOCUMENT, out.toString());
    }

    @Test
    @DisplayName("Should wrap sink failures in UncheckedIOException")
    void testDumpFailure() throws IOException {
        // Given
        Automaton automaton = HoaFormat.parse(DOCUMENT);

        // When
        UncheckedIOException e = assertThrows(UncheckedIOException.class, () -> HoaFormat.dump(automaton, failingSink));

        // Then
        assertEquals("disk full", e.getCause().getMessage());
        verify(failingSink, atLeastOnce()).append(any(CharSequence.class));
    }

    @Test
    @DisplayName("Should surface parse errors as HoaParseException")
    void testParseError() {
        assertThrows(HoaParseException.class, () -> HoaFormat.parse("HOA: v1\n--BODY--\n--END--\n"));
    }
}
