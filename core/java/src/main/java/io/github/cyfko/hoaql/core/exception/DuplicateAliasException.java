package io.github.cyfko.hoaql.core.exception;

/**
 * Thrown when two {@code Alias:} headers define the same name.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DuplicateAliasException extends HoaValidationException {

    private final String alias;

    /**
     * @param alias the alias name, including its leading {@code @}
     */
    public DuplicateAliasException(String alias) {
        super("Alias " + alias + " is defined more than once");
        this.alias = alias;
    }

    public String getAlias() {
        return alias;
    }
}
