package io.github.cyfko.whereql.core.exception;

import io.github.cyfko.whereql.core.utils.JsonValues;

/**
 * Exception thrown when an operator of a filter document receives an operand it
 * cannot work with.
 * <p>
 * The exception keeps the offending operator token and the operand exactly as the
 * client sent it, so the error reaching the client names both:
 * </p>
 * <pre>{@code
 * {"$in": "not-a-list"}    →  Invalid $in condition: "not-a-list"
 * {"$exists": "yes"}       →  Invalid $exists condition: "yes"
 * {"$geo.within": {"type": "circle", "coordinates": [1, 2]}}
 *                          →  Invalid $geo.within condition: {"type":"circle","coordinates":[1,2]}
 * }</pre>
 *
 * <p><strong>Propagation:</strong> the compiler never wraps or translates this
 * exception. It travels unmodified from the validator that detected the problem to
 * the request boundary, which turns it into a 400 response.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see io.github.cyfko.whereql.core.pipeline.QueryFilterStage
 */
public class QueryException extends RuntimeException {

    private final String operator;
    private final transient Object value;

    /**
     * Creates an exception for {@code operator} rejecting {@code value}.
     *
     * @param operator the operator token, e.g. {@code $in}
     * @param value    the operand as decoded from the filter document
     */
    public QueryException(String operator, Object value) {
        this(operator, value, generateMessage(operator, value));
    }

    /**
     * Creates an exception with a custom message, for subclasses reporting problems
     * that are not a single bad operand.
     *
     * @param operator the operator token or field name where the problem was detected
     * @param value    the offending value
     * @param message  the message sent back to the client
     */
    protected QueryException(String operator, Object value, String message) {
        super(message);
        this.operator = operator;
        this.value = value;
    }

    /**
     * @return the operator token whose operand was refused
     */
    public String getOperator() {
        return operator;
    }

    /**
     * @return the refused operand, as decoded from JSON
     */
    public Object getValue() {
        return value;
    }

    /**
     * Builds the client-facing message for an operator and its operand.
     *
     * @param operator the operator token
     * @param value    the offending operand
     * @return {@code Invalid <operator> condition: <value as JSON>}
     */
    public static String generateMessage(String operator, Object value) {
        return "Invalid " + operator + " condition: " + JsonValues.render(value);
    }
}
