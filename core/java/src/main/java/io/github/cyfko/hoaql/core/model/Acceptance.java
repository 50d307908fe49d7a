package io.github.cyfko.hoaql.core.model;

import io.github.cyfko.hoaql.core.formula.AcceptanceCondition;
import io.github.cyfko.hoaql.core.formula.AcceptanceConditions;

import java.util.List;
import java.util.Objects;

/**
 * The acceptance of an automaton: the {@code Acceptance:} condition and the optional
 * {@code acc-name:} descriptor that names it.
 *
 * <pre>{@code
 * Acceptance: 2 Inf(0) & Inf(1)
 * acc-name: generalized-Buchi 2
 * }</pre>
 * <p>
 * The number of acceptance sets is not stored; it is always derived from the condition with
 * {@link #setCount()}.
 * </p>
 *
 * @param condition  the acceptance condition
 * @param name       the {@code acc-name:} identifier, or {@code null} when absent
 * @param parameters the {@code acc-name:} parameters; booleans, integers and identifiers only
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Acceptance(AcceptanceCondition condition, Identifier name, List<HeaderValue> parameters) {

    public Acceptance {
        Objects.requireNonNull(condition, "Acceptance condition is required");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        if (name == null && !parameters.isEmpty()) {
            throw new IllegalArgumentException("acc-name parameters require an acc-name");
        }
        for (HeaderValue parameter : parameters) {
            if (parameter instanceof HeaderValue.StringValue) {
                throw new IllegalArgumentException("acc-name parameters cannot be strings: " + parameter.toHoaToken());
            }
        }
    }

    /**
     * Unnamed acceptance.
     */
    public static Acceptance of(AcceptanceCondition condition) {
        return new Acceptance(condition, null, List.of());
    }

    public static Acceptance of(AcceptanceCondition condition, Identifier name, HeaderValue... parameters) {
        return new Acceptance(condition, name, List.of(parameters));
    }

    /**
     * Number of acceptance sets used by the condition, as printed after {@code Acceptance:}.
     */
    public int setCount() {
        return AcceptanceConditions.countAcceptingSets(condition);
    }
}
