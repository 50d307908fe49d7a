package io.github.cyfko.hoaql.core.model;

import io.github.cyfko.hoaql.core.config.PatternConfig;
import io.github.cyfko.hoaql.core.exception.InvalidTokenException;

import java.util.List;

/**
 * Checks for the text that the model stores without its surrounding quotes: state names,
 * the automaton name, tool fields, proposition names and string header values.
 */
final class QuotedStrings {

    private QuotedStrings() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @return {@code text}, which may be {@code null}
     * @throws InvalidTokenException if quoting {@code text} would not give a single HOA string
     */
    static String check(String text) {
        if (text != null && !PatternConfig.STRING_CONTENT_PATTERN.matcher(text).matches()) {
            throw new InvalidTokenException("string", text);
        }
        return text;
    }

    static List<String> checkAll(List<String> texts) {
        texts.forEach(QuotedStrings::check);
        return texts;
    }
}
