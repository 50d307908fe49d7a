package io.github.cyfko.hoaql.core.model;

import io.github.cyfko.hoaql.core.formula.LabelAlias;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The header section of an HOA document.
 *
 * <h2>Header Items</h2>
 * <ul>
 *   <li><strong>formatVersion</strong>: {@code HOA: v1}</li>
 *   <li><strong>states</strong>: {@code States: n}, or {@code null} when undeclared</li>
 *   <li><strong>startStates</strong>: one conjunction per {@code Start:} line, in file order;
 *       a line with several states ({@code Start: 0 & 2}) is an alternating start</li>
 *   <li><strong>propositions</strong>: the names of {@code AP:}, unquoted</li>
 *   <li><strong>aliases</strong>: the {@code Alias:} definitions, in file order</li>
 *   <li><strong>acceptance</strong>: {@code Acceptance:} and {@code acc-name:}</li>
 *   <li><strong>tool</strong>: {@code tool: "name" "version"}, empty when absent</li>
 *   <li><strong>name</strong>: {@code name: "..."}, unquoted, or {@code null}</li>
 *   <li><strong>properties</strong>: the identifiers of every {@code properties:} line</li>
 *   <li><strong>customHeaders</strong>: any other header, keyed by name without the colon</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Header header = Header.builder()
 *     .states(2)
 *     .startState(0)
 *     .propositions(List.of("a"))
 *     .acceptance(Acceptance.of(AcceptanceConditions.inf(0)))
 *     .property(new Identifier("deterministic"))
 *     .build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Header(
    Identifier formatVersion,
    Integer states,
    Set<Set<Integer>> startStates,
    List<String> propositions,
    List<LabelAlias> aliases,
    Acceptance acceptance,
    List<String> tool,
    String name,
    List<Identifier> properties,
    Map<String, List<HeaderValue>> customHeaders
) {

    /**
     * Format version written by the printer when none is given.
     */
    public static final String DEFAULT_VERSION = "v1";

    public Header {
        Objects.requireNonNull(formatVersion, "Format version is required");
        Objects.requireNonNull(acceptance, "Acceptance is required");
        if (states != null && states < 0) {
            throw new IllegalArgumentException("States count must be non-negative, got: " + states);
        }
        Set<Set<Integer>> starts = new LinkedHashSet<>();
        for (Set<Integer> conjunction : startStates == null ? Set.<Set<Integer>>of() : startStates) {
            if (conjunction.isEmpty()) {
                throw new IllegalArgumentException("A start conjunction needs at least one state");
            }
            starts.add(Collections.unmodifiableSet(new LinkedHashSet<>(conjunction)));
        }
        startStates = Collections.unmodifiableSet(starts);
        propositions = propositions == null ? List.of() : QuotedStrings.checkAll(List.copyOf(propositions));
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        tool = tool == null ? List.of() : QuotedStrings.checkAll(List.copyOf(tool));
        if (tool.size() > 2) {
            throw new IllegalArgumentException("tool: takes a name and an optional version, got: " + tool);
        }
        QuotedStrings.check(name);
        properties = properties == null ? List.of() : List.copyOf(properties);
        Map<String, List<HeaderValue>> custom = new LinkedHashMap<>();
        if (customHeaders != null) {
            customHeaders.forEach((key, values) -> custom.put(key, List.copyOf(values)));
        }
        customHeaders = Collections.unmodifiableMap(custom);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable accumulator mirroring the way headers are read: repeated items
     * ({@code Start:}, {@code Alias:}, {@code properties:}) are appended in call order.
     */
    public static class Builder {
        private Identifier _formatVersion = new Identifier(DEFAULT_VERSION);
        private Integer _states;
        private final Set<Set<Integer>> _startStates = new LinkedHashSet<>();
        private List<String> _propositions = List.of();
        private final List<LabelAlias> _aliases = new ArrayList<>();
        private Acceptance _acceptance;
        private List<String> _tool = List.of();
        private String _name;
        private final List<Identifier> _properties = new ArrayList<>();
        private final Map<String, List<HeaderValue>> _customHeaders = new LinkedHashMap<>();

        private Builder() {}

        public Header build() {
            return new Header(_formatVersion, _states, _startStates, _propositions, _aliases,
                    _acceptance, _tool, _name, _properties, _customHeaders);
        }

        public Builder formatVersion(Identifier formatVersion) { this._formatVersion = formatVersion; return this; }
        public Builder states(Integer states) { this._states = states; return this; }
        public Builder propositions(List<String> propositions) { this._propositions = propositions; return this; }
        public Builder acceptance(Acceptance acceptance) { this._acceptance = acceptance; return this; }
        public Builder name(String name) { this._name = name; return this; }
        public Builder alias(LabelAlias alias) { this._aliases.add(alias); return this; }
        public Builder property(Identifier property) { this._properties.add(property); return this; }

        public Builder properties(Collection<Identifier> properties) {
            this._properties.addAll(properties);
            return this;
        }

        /**
         * Adds one {@code Start:} line; several states form an alternating start conjunction.
         */
        public Builder startState(Integer... conjunction) {
            return startStates(List.of(conjunction));
        }

        public Builder startStates(Collection<Integer> conjunction) {
            this._startStates.add(new LinkedHashSet<>(conjunction));
            return this;
        }

        public Builder tool(String toolName) {
            this._tool = List.of(toolName);
            return this;
        }

        public Builder tool(String toolName, String version) {
            this._tool = List.of(toolName, version);
            return this;
        }

        /**
         * Sets a custom header; {@code headerName} is given without its trailing colon.
         */
        public Builder customHeader(String headerName, List<HeaderValue> values) {
            this._customHeaders.put(headerName, values);
            return this;
        }
    }
}
