package io.github.cyfko.hoaql.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The body of an automaton: each declared state with its outgoing edges, in file order.
 *
 * @param edges states mapped to their edges; iteration follows declaration order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Body(Map<State, List<Edge>> edges) {

    public Body {
        Map<State, List<Edge>> copy = new LinkedHashMap<>();
        edges.forEach((state, stateEdges) -> copy.put(state, List.copyOf(stateEdges)));
        edges = Collections.unmodifiableMap(copy);
    }

    public static Body empty() {
        return new Body(Map.of());
    }

    /**
     * Declared states in file order.
     */
    public List<State> states() {
        return List.copyOf(edges.keySet());
    }

    /**
     * Edges leaving {@code state}; empty if the state has none or is not part of this body.
     */
    public List<Edge> edges(State state) {
        return edges.getOrDefault(state, List.of());
    }

    /**
     * Looks a state up by its index.
     */
    public Optional<State> state(int index) {
        return edges.keySet().stream().filter(s -> s.index() == index).findFirst();
    }
}
