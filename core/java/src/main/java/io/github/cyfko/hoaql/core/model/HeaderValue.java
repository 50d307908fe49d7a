package io.github.cyfko.hoaql.core.model;

import io.github.cyfko.hoaql.core.config.HoaReservedSymbol;

import java.util.Objects;

/**
 * A typed value of a header line: acceptance-name parameter or custom header argument.
 * <p>
 * HOA distinguishes four token kinds in these positions and a printer must restore the
 * right one, so values keep their kind instead of being flattened to text.
 * </p>
 *
 * <pre>{@code
 * acc-name: generalized-Buchi 3          // IdentifierValue, IntegerValue
 * controllable-AP: 0 2                   // IntegerValue, IntegerValue
 * tool-flags: t "--deterministic" raw    // BooleanValue, StringValue, IdentifierValue
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface HeaderValue {

    /**
     * Renders this value as the HOA token it was read from.
     */
    String toHoaToken();

    static HeaderValue of(boolean value) {
        return new BooleanValue(value);
    }

    static HeaderValue of(int value) {
        return new IntegerValue(value);
    }

    static HeaderValue string(String value) {
        return new StringValue(value);
    }

    static HeaderValue identifier(String value) {
        return new IdentifierValue(new Identifier(value));
    }

    /**
     * {@code t} or {@code f}.
     */
    record BooleanValue(boolean value) implements HeaderValue {
        @Override
        public String toHoaToken() {
            return value ? HoaReservedSymbol.TRUE : HoaReservedSymbol.FALSE;
        }
    }

    /**
     * A non-negative integer.
     */
    record IntegerValue(int value) implements HeaderValue {
        public IntegerValue {
            if (value < 0) {
                throw new IllegalArgumentException("Header integers are non-negative, got: " + value);
            }
        }

        @Override
        public String toHoaToken() {
            return Integer.toString(value);
        }
    }

    /**
     * A double-quoted string. The value holds the text between the quotes, escape sequences
     * included as written.
     */
    record StringValue(String value) implements HeaderValue {
        public StringValue {
            QuotedStrings.check(Objects.requireNonNull(value, "String value is required"));
        }

        @Override
        public String toHoaToken() {
            return '"' + value + '"';
        }
    }

    /**
     * A bare identifier.
     */
    record IdentifierValue(Identifier value) implements HeaderValue {
        public IdentifierValue {
            Objects.requireNonNull(value, "Identifier is required");
        }

        @Override
        public String toHoaToken() {
            return value.value();
        }
    }
}
