package io.github.cyfko.whereql.core.utils;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of validating an operator operand.
 * <p>
 * The result either carries the validated (possibly converted) value, or an error
 * message explaining why the operand was refused. Validators never throw: they
 * return a failure and let the caller decide how to surface it.
 * </p>
 *
 * <p>Instances are immutable and created via the static methods
 * {@link #success(Object)} and {@link #failure(String)}.</p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * ValidationResult<Object> result = QueryOperator.IN.validator().validate(value);
 * if (!result.isValid()) {
 *     throw new QueryException("$in", value);
 * }
 * Object operand = result.getValue();
 * }</pre>
 *
 * @param <T> type of the validated value
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValidationResult<T> {

    private final boolean valid;
    private final T value;
    private final String errorMessage;

    private ValidationResult(boolean valid, T value, String errorMessage) {
        this.valid = valid;
        this.value = value;
        this.errorMessage = errorMessage;
    }

    /**
     * Creates a successful result holding the validated value.
     *
     * @param value validated value, may be {@code null} for operators accepting JSON null
     * @param <T>   type of the value
     * @return a valid result
     */
    public static <T> ValidationResult<T> success(T value) {
        return new ValidationResult<>(true, value, null);
    }

    /**
     * Creates a failed result with an error message.
     *
     * @param errorMessage message explaining the reason for failure
     * @param <T>          expected type of the value
     * @return an invalid result containing the provided error message
     * @throws NullPointerException if {@code errorMessage} is null
     */
    public static <T> ValidationResult<T> failure(String errorMessage) {
        return new ValidationResult<>(false, null, Objects.requireNonNull(errorMessage, "errorMessage"));
    }

    /**
     * @return true if valid, false otherwise
     */
    public boolean isValid() {
        return valid;
    }

    /**
     * Returns the validated value.
     *
     * @return the value held by a successful result
     * @throws IllegalStateException if the result is a failure
     */
    public T getValue() {
        if (!valid) {
            throw new IllegalStateException("No value on a failed validation: " + errorMessage);
        }
        return value;
    }

    /**
     * @return error message if invalid, or null if valid
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * Transforms the value of a successful result; failures pass through unchanged.
     *
     * @param mapper function applied to the value
     * @param <R>    type of the transformed value
     * @return the transformed result
     */
    public <R> ValidationResult<R> map(Function<? super T, ? extends R> mapper) {
        return valid ? success(mapper.apply(value)) : failure(errorMessage);
    }

    @Override
    public String toString() {
        return valid ? "ValidationResult[valid=true, value=" + value + "]"
                : "ValidationResult[valid=false, error=" + errorMessage + "]";
    }
}
