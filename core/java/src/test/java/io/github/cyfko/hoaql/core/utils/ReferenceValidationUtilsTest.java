package io.github.cyfko.hoaql.core.utils;

import io.github.cyfko.hoaql.core.config.HoaPolicy;
import io.github.cyfko.hoaql.core.exception.UndeclaredIndexException;
import io.github.cyfko.hoaql.core.exception.UndeclaredIndexException.Kind;
import io.github.cyfko.hoaql.core.impl.BasicHoaParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Strict reference checks, exercised through a parser running {@link HoaPolicy#strict()}.
 */
@DisplayName("ReferenceValidationUtils Tests")
class ReferenceValidationUtilsTest {

    private BasicHoaParser strictParser;
    private BasicHoaParser defaultParser;

    @BeforeEach
    void setUp() {
        strictParser = new BasicHoaParser(HoaPolicy.strict());
        defaultParser = new BasicHoaParser();
    }

    private static String document(String headerItems, String body) {
        return "HOA: v1\nStates: 2\nAP: 1 \"a\"\n" + headerItems
                + "Acceptance: 1 Inf(0)\n--BODY--\n" + body + "--END--\n";
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Start: 2\\n||STATE|2|2",
            "|State: 3\\n|STATE|3|2",
            "|State: 0\\n0 & 5\\n|STATE|5|2",
            "|State: 0\\n[1] 0\\n|PROPOSITION|1|1",
            "|'State: [0 | !3] 0\\n'|PROPOSITION|3|1",
            "Alias: @x 2\\n||PROPOSITION|2|1",
            "|State: 0 {1}\\n|ACCEPTANCE_SET|1|1",
            "|State: 0\\n1 {0 4}\\n|ACCEPTANCE_SET|4|1"
    })
    @DisplayName("Should reject indices beyond their declared bound")
    void testUndeclaredIndices(String headerItems, String body, Kind kind, int index, int bound) {
        // Given
        String text = document(unescape(headerItems), unescape(body));

        // When
        UndeclaredIndexException e = assertThrows(UndeclaredIndexException.class, () -> strictParser.parse(text));

        // Then
        assertEquals(kind, e.getKind());
        assertEquals(index, e.getIndex());
        assertEquals(bound, e.getBound());

        assertDoesNotThrow(() -> defaultParser.parse(text));
    }

    private static String unescape(String value) {
        return value == null ? "" : value.replace("\\n", "\n");
    }

    @Test
    @DisplayName("Should accept a consistent automaton")
    void testValid() {
        assertDoesNotThrow(() -> strictParser.parse(document("Start: 0 & 1\n",
                "State: [0] 0 {0}\n[!0] 1\nState: 1\n1 {0}\n")));
    }

    @Test
    @DisplayName("Should skip state bounds when States is absent")
    void testNoStatesHeader() {
        assertDoesNotThrow(() -> strictParser.parse(
                "HOA: v1\nStart: 7\nAcceptance: 0 t\n--BODY--\nState: 9\n12\n--END--\n"));
    }

    @Test
    @DisplayName("Should check an index collection directly")
    void testCheckIndices() {
        assertDoesNotThrow(() -> ReferenceValidationUtils.checkIndices(Kind.STATE, null, 0));
        assertDoesNotThrow(() -> ReferenceValidationUtils.checkIndices(Kind.STATE, List.of(0, 1), 2));
        assertThrows(UndeclaredIndexException.class,
                () -> ReferenceValidationUtils.checkIndices(Kind.STATE, List.of(0, 2), 2));
    }
}
