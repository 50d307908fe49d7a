package io.github.cyfko.hoaql.core.exception;

/**
 * Thrown when the expression of a label alias is requested but was never bound.
 * <p>
 * Parsed documents never contain unresolved aliases; this only happens for references built
 * by hand with {@link io.github.cyfko.hoaql.core.formula.LabelAlias#unresolved}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UnresolvedAliasException extends IllegalStateException {

    private final String alias;

    public UnresolvedAliasException(String alias) {
        super("Alias " + alias + " has no bound expression");
        this.alias = alias;
    }

    public String getAlias() {
        return alias;
    }
}
