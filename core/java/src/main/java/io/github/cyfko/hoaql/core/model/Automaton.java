package io.github.cyfko.hoaql.core.model;

import java.util.Objects;

/**
 * A complete HOA document.
 *
 * @param header the header section
 * @param body   the body section
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Automaton(Header header, Body body) {

    public Automaton {
        Objects.requireNonNull(header, "Header is required");
        Objects.requireNonNull(body, "Body is required");
    }
}
