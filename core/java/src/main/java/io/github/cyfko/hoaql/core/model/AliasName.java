package io.github.cyfko.hoaql.core.model;

import io.github.cyfko.hoaql.core.config.PatternConfig;
import io.github.cyfko.hoaql.core.exception.InvalidTokenException;

/**
 * An HOA {@code ANAME} token, e.g. {@code @a} or {@code @no-go}.
 *
 * @param value the alias name including the leading {@code @}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record AliasName(String value) {

    /**
     * @throws InvalidTokenException if {@code value} does not match {@link PatternConfig#ALIAS_PATTERN}
     */
    public AliasName {
        if (value == null || !PatternConfig.ALIAS_PATTERN.matcher(value).matches()) {
            throw new InvalidTokenException("alias name", value);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
