package io.github.cyfko.hoaql.core.exception;

/**
 * Thrown when a label references an alias that has not been defined by an earlier
 * {@code Alias:} header. Forward references are rejected.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UndefinedAliasException extends HoaValidationException {

    private final String alias;

    /**
     * @param alias the referenced alias name, including its leading {@code @}
     */
    public UndefinedAliasException(String alias) {
        super("Alias " + alias + " is referenced before its definition");
        this.alias = alias;
    }

    public String getAlias() {
        return alias;
    }
}
