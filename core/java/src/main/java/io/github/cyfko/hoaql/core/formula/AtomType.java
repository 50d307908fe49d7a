package io.github.cyfko.hoaql.core.formula;

import java.util.Arrays;
import java.util.Optional;

/**
 * The two kinds of acceptance atoms.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum AtomType {

    /**
     * The marked set is visited finitely often.
     */
    FIN("Fin"),

    /**
     * The marked set is visited infinitely often.
     */
    INF("Inf");

    private final String keyword;

    AtomType(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the HOA keyword of this atom type ({@code Fin} or {@code Inf}).
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Looks up an atom type by its case-sensitive HOA keyword.
     *
     * @param keyword the identifier read in front of the parenthesis
     * @return the matching type, or empty when the keyword is neither {@code Fin} nor {@code Inf}
     */
    public static Optional<AtomType> fromKeyword(String keyword) {
        return Arrays.stream(values())
                .filter(type -> type.keyword.equals(keyword))
                .findFirst();
    }

    @Override
    public String toString() {
        return keyword;
    }
}
