package io.github.cyfko.hoaql.core.exception;

/**
 * Thrown when a header that may appear at most once ({@code States:}, {@code Acceptance:},
 * {@code acc-name:}, {@code tool:}, {@code name:} or any custom header) is repeated.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DuplicateHeaderException extends HoaValidationException {

    private final String headerName;

    /**
     * @param headerName the repeated header, including its trailing colon
     */
    public DuplicateHeaderException(String headerName) {
        super("Header '" + headerName + "' may appear only once");
        this.headerName = headerName;
    }

    public String getHeaderName() {
        return headerName;
    }
}
