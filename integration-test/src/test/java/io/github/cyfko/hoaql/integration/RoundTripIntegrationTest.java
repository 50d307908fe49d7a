package io.github.cyfko.hoaql.integration;

import io.github.cyfko.hoaql.core.api.HoaParser;
import io.github.cyfko.hoaql.core.api.HoaPrinter;
import io.github.cyfko.hoaql.core.config.HoaPolicy;
import io.github.cyfko.hoaql.core.impl.BasicHoaParser;
import io.github.cyfko.hoaql.core.impl.CanonicalHoaPrinter;
import io.github.cyfko.hoaql.core.model.Automaton;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.net.URISyntaxException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Reads every document of the corpus, prints it and reads it back.
 */
@DisplayName("Round-trip over the HOA corpus")
class RoundTripIntegrationTest {

    private HoaParser parser;
    private HoaPrinter printer;

    @BeforeEach
    void setUp() {
        parser = new BasicHoaParser();
        printer = new CanonicalHoaPrinter();
    }

    static Stream<String> corpus() throws IOException, URISyntaxException {
        return HoaCorpus.names();
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("corpus")
    @DisplayName("parse(print(parse(d))) equals parse(d)")
    void testParsePrintParse(String name) {
        // Given
        Automaton original = parser.parse(HoaCorpus.read(name));

        // When
        Automaton reparsed = parser.parse(printer.print(original));

        // Then
        assertEquals(original, reparsed);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("corpus")
    @DisplayName("printing is idempotent")
    void testPrintIdempotent(String name) {
        String canonical = printer.print(parser.parse(HoaCorpus.read(name)));

        assertEquals(canonical, printer.print(parser.parse(canonical)));
        assertTrue(canonical.endsWith("--END--\n"));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("corpus")
    @DisplayName("every corpus document declares its indices")
    void testStrictPolicy(String name) {
        HoaParser strict = new BasicHoaParser(HoaPolicy.strict());

        assertDoesNotThrow(() -> strict.parse(HoaCorpus.read(name)));
    }
}
