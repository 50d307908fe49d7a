package io.github.cyfko.hoaql.core.impl;

import io.github.cyfko.hoaql.core.api.HoaPrinter;
import io.github.cyfko.hoaql.core.config.HoaReservedSymbol;
import io.github.cyfko.hoaql.core.formula.FormulaRenderer;
import io.github.cyfko.hoaql.core.formula.LabelAlias;
import io.github.cyfko.hoaql.core.formula.LabelExpression;
import io.github.cyfko.hoaql.core.model.Acceptance;
import io.github.cyfko.hoaql.core.model.Automaton;
import io.github.cyfko.hoaql.core.model.Edge;
import io.github.cyfko.hoaql.core.model.Header;
import io.github.cyfko.hoaql.core.model.HeaderValue;
import io.github.cyfko.hoaql.core.model.Identifier;
import io.github.cyfko.hoaql.core.model.State;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link HoaPrinter} writing every automaton in one canonical layout.
 *
 * <h2>Layout</h2>
 * <p>Header items are written in a fixed order, one per line, skipping absent ones:</p>
 * <pre>{@code
 * HOA: v1
 * States: 2
 * Start: 0
 * AP: 2 "a" "b"
 * Alias: @both (0 & 1)
 * Acceptance: 1 Inf(0)
 * acc-name: Buchi
 * tool: "ltl2tgba" "2.9"
 * name: "GFa"
 * properties: trans-labels explicit-labels
 * custom-header: 1 t "text" ident
 * --BODY--
 * State: 0 "init" {0}
 * [@both] 1
 * [!0] 0 & 1 {0}
 * State: 1
 * --END--
 * }</pre>
 *
 * <p>
 * Formulas use {@link FormulaRenderer}, so every compound sub-formula is parenthesized,
 * the acceptance count is recomputed from the condition and acceptance signatures come out
 * in ascending order. Reading the output back yields an equal automaton, and printing that
 * automaton again yields the same text.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class CanonicalHoaPrinter implements HoaPrinter {

    private static final String CONJUNCTION = " " + HoaReservedSymbol.AND + " ";

    @Override
    public String print(Automaton automaton) {
        StringBuilder out = new StringBuilder();
        try {
            print(automaton, out);
        } catch (IOException e) {
            throw new IllegalStateException("StringBuilder cannot fail", e);
        }
        return out.toString();
    }

    @Override
    public void print(Automaton automaton, Appendable out) throws IOException {
        writeHeader(automaton.header(), out);
        line(out, HoaReservedSymbol.BODY);
        for (Map.Entry<State, List<Edge>> entry : automaton.body().edges().entrySet()) {
            line(out, state(entry.getKey()));
            for (Edge edge : entry.getValue()) {
                line(out, edge(edge));
            }
        }
        line(out, HoaReservedSymbol.END);
    }

    private void writeHeader(Header header, Appendable out) throws IOException {
        line(out, "HOA: " + header.formatVersion());
        if (header.states() != null) {
            line(out, "States: " + header.states());
        }
        for (Set<Integer> conjunction : header.startStates()) {
            line(out, "Start: " + conjunction(conjunction));
        }
        if (!header.propositions().isEmpty()) {
            line(out, "AP: " + header.propositions().size() + " " + header.propositions().stream()
                    .map(CanonicalHoaPrinter::quote)
                    .collect(Collectors.joining(" ")));
        }
        for (LabelAlias alias : header.aliases()) {
            line(out, "Alias: " + alias.name() + " " + FormulaRenderer.renderLabel(alias.expression()));
        }

        Acceptance acceptance = header.acceptance();
        line(out, "Acceptance: " + acceptance.setCount() + " " + FormulaRenderer.renderAcceptance(acceptance.condition()));
        if (acceptance.name() != null) {
            line(out, join("acc-name:", acceptance.name().value(), tokens(acceptance.parameters())));
        }

        if (!header.tool().isEmpty()) {
            line(out, "tool: " + header.tool().stream()
                    .map(CanonicalHoaPrinter::quote)
                    .collect(Collectors.joining(" ")));
        }
        if (header.name() != null) {
            line(out, "name: " + quote(header.name()));
        }
        if (!header.properties().isEmpty()) {
            line(out, "properties: " + header.properties().stream()
                    .map(Identifier::value)
                    .collect(Collectors.joining(" ")));
        }
        for (Map.Entry<String, List<HeaderValue>> custom : header.customHeaders().entrySet()) {
            line(out, join(custom.getKey() + ":", tokens(custom.getValue())));
        }
    }

    private static String state(State state) {
        return join("State:",
                label(state.label()),
                Integer.toString(state.index()),
                state.name() == null ? "" : quote(state.name()),
                accSig(state.accSig()));
    }

    private static String edge(Edge edge) {
        return join(label(edge.label()), conjunction(edge.successors()), accSig(edge.accSig()));
    }

    private static String label(LabelExpression label) {
        return label == null ? "" : "[" + FormulaRenderer.renderLabel(label) + "]";
    }

    private static String accSig(Set<Integer> accSig) {
        if (accSig == null) {
            return "";
        }
        return accSig.stream().map(String::valueOf).collect(Collectors.joining(" ", "{", "}"));
    }

    private static String conjunction(Collection<Integer> states) {
        return states.stream().map(String::valueOf).collect(Collectors.joining(CONJUNCTION));
    }

    private static String tokens(List<HeaderValue> values) {
        return values.stream().map(HeaderValue::toHoaToken).collect(Collectors.joining(" "));
    }

    private static String quote(String text) {
        return '"' + text + '"';
    }

    /**
     * Space-joins the non-empty parts.
     */
    private static String join(String... parts) {
        StringBuilder joined = new StringBuilder();
        for (String part : parts) {
            if (part.isEmpty()) {
                continue;
            }
            if (joined.length() > 0) {
                joined.append(' ');
            }
            joined.append(part);
        }
        return joined.toString();
    }

    private static void line(Appendable out, String text) throws IOException {
        out.append(text).append('\n');
    }
}
