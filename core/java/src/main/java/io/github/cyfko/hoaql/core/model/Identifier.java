package io.github.cyfko.hoaql.core.model;

import io.github.cyfko.hoaql.core.config.PatternConfig;
import io.github.cyfko.hoaql.core.exception.InvalidTokenException;

/**
 * An HOA {@code IDENTIFIER} token: format version, acceptance name, property or custom value.
 *
 * @param value the raw identifier text, matching {@link PatternConfig#IDENTIFIER_PATTERN}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Identifier(String value) {

    /**
     * @throws InvalidTokenException if {@code value} is null or not a valid identifier
     */
    public Identifier {
        if (value == null || !PatternConfig.IDENTIFIER_PATTERN.matcher(value).matches()) {
            throw new InvalidTokenException("identifier", value);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
