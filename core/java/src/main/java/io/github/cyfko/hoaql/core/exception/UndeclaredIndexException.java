package io.github.cyfko.hoaql.core.exception;

/**
 * Thrown under a strict {@link io.github.cyfko.hoaql.core.config.HoaPolicy} when an index
 * used in the document is not below the bound its header declares.
 *
 * <p><strong>Checked references:</strong></p>
 * <ul>
 *   <li>{@link Kind#STATE}: {@code Start:}, {@code State:} and edge targets against {@code States:}</li>
 *   <li>{@link Kind#PROPOSITION}: label atoms against the {@code AP:} count</li>
 *   <li>{@link Kind#ACCEPTANCE_SET}: acceptance signatures against the {@code Acceptance:} count</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UndeclaredIndexException extends HoaValidationException {

    public enum Kind {
        STATE("state"),
        PROPOSITION("atomic proposition"),
        ACCEPTANCE_SET("acceptance set");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private final Kind kind;
    private final int index;
    private final int bound;

    /**
     * @param kind  what the index refers to
     * @param index the offending index
     * @param bound the declared count; valid indices are {@code 0..bound-1}
     */
    public UndeclaredIndexException(Kind kind, int index, int bound) {
        super("Undeclared " + kind.description() + " " + index + " (declared: " + bound + ")");
        this.kind = kind;
        this.index = index;
        this.bound = bound;
    }

    public Kind getKind() {
        return kind;
    }

    public int getIndex() {
        return index;
    }

    public int getBound() {
        return bound;
    }
}
