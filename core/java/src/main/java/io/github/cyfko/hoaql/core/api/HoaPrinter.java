package io.github.cyfko.hoaql.core.api;

import io.github.cyfko.hoaql.core.model.Automaton;

import java.io.IOException;

/**
 * Interface defining the contract for writing {@link Automaton} values as HOA text.
 * <p>
 * Printing is total: every automaton value has a textual form, and reading that form back
 * with a {@link HoaParser} yields an equal automaton.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see HoaParser
 */
public interface HoaPrinter {

    /**
     * Renders {@code automaton} as a complete HOA document.
     *
     * @param automaton the automaton to print
     * @return the document text, ending with {@code --END--} and a newline
     */
    String print(Automaton automaton);

    /**
     * Writes {@code automaton} to {@code out}.
     *
     * @param automaton the automaton to print
     * @param out       the destination
     * @throws IOException if the destination fails
     */
    default void print(Automaton automaton, Appendable out) throws IOException {
        out.append(print(automaton));
    }
}
