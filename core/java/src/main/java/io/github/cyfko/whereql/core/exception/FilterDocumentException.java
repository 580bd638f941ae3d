package io.github.cyfko.whereql.core.exception;

/**
 * Thrown when the raw filter parameter is not a JSON object.
 * <p>
 * Covers malformed JSON, trailing garbage, oversized input and top-level values
 * other than an object. The detail stays server-side: clients only ever see
 * {@code "invalid value"}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterDocumentException extends RuntimeException {

    /**
     * @param message description of the decoding problem
     */
    public FilterDocumentException(String message) {
        super(message);
    }

    /**
     * @param message description of the decoding problem
     * @param cause   the underlying parser failure
     */
    public FilterDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
