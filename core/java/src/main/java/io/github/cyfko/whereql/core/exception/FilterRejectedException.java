package io.github.cyfko.whereql.core.exception;

import java.util.Map;

/**
 * Client error raised by the request stage when a filter parameter cannot be applied.
 * <p>
 * This is the only exception of the library meant to cross the request boundary. It
 * carries everything needed to write the response:
 * </p>
 * <ul>
 *   <li>status {@value #STATUS}</li>
 *   <li>body {@code {"errors": {<parameter>: <message>}}}</li>
 * </ul>
 * <p>
 * The message is either {@value #INVALID_VALUE} for undecodable input, or the
 * {@link QueryException} message for a semantic problem.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterRejectedException extends RuntimeException {

    /** HTTP status of a rejected filter. */
    public static final int STATUS = 400;

    /** Message used when the parameter is not a decodable JSON object. */
    public static final String INVALID_VALUE = "invalid value";

    private final String parameter;
    private final String reason;

    /**
     * @param parameter name of the query parameter holding the filter
     * @param reason    client-facing message
     * @param cause     the decoding or compilation failure
     */
    public FilterRejectedException(String parameter, String reason, Throwable cause) {
        super(parameter + ": " + reason, cause);
        this.parameter = parameter;
        this.reason = reason;
    }

    /**
     * @return name of the offending query parameter
     */
    public String getParameter() {
        return parameter;
    }

    /**
     * @return the client-facing message for the parameter
     */
    public String getReason() {
        return reason;
    }

    /**
     * @return the HTTP status to answer with
     */
    public int getStatus() {
        return STATUS;
    }

    /**
     * @return field-scoped errors, keyed by parameter name
     */
    public Map<String, String> getErrors() {
        return Map.of(parameter, reason);
    }

    /**
     * @return the response body: {@code {"errors": {<parameter>: <message>}}}
     */
    public Map<String, Object> toBody() {
        return Map.of("errors", getErrors());
    }
}
