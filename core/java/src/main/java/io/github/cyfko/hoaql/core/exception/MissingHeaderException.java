package io.github.cyfko.hoaql.core.exception;

/**
 * Thrown when a mandatory header is absent from the document.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class MissingHeaderException extends HoaValidationException {

    private final String headerName;

    public MissingHeaderException(String headerName) {
        super("Missing mandatory header '" + headerName + "'");
        this.headerName = headerName;
    }

    public String getHeaderName() {
        return headerName;
    }
}
