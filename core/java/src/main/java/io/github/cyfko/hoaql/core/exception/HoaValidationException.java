package io.github.cyfko.hoaql.core.exception;

/**
 * Base type of the semantic errors found in a syntactically valid HOA document.
 * <p>
 * Each subclass names one rule of the format and exposes the values involved through typed
 * getters, so callers can react without parsing the message.
 * </p>
 *
 * <p><strong>Subclasses:</strong></p>
 * <ul>
 *   <li>{@link DuplicateHeaderException}: a singular header appears twice</li>
 *   <li>{@link MissingHeaderException}: a mandatory header is absent</li>
 *   <li>{@link DuplicateAliasException} / {@link UndefinedAliasException}: alias table errors</li>
 *   <li>{@link PropositionCountException} / {@link DuplicatePropositionException}: {@code AP:} errors</li>
 *   <li>{@link AcceptanceSetMismatchException}: {@code Acceptance:} count and condition disagree</li>
 *   <li>{@link DuplicateStateException}: a state is declared twice in the body</li>
 *   <li>{@link UndeclaredIndexException}: an index exceeds its declared bound (strict policy)</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class HoaValidationException extends HoaParseException {

    /**
     * @param message the description of the violated rule
     */
    public HoaValidationException(String message) {
        super(message);
    }

    /**
     * @param message the description of the violated rule
     * @param cause   the original cause of the exception
     */
    public HoaValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
