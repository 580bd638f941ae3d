package io.github.cyfko.whereql.core.operator;

import io.github.cyfko.whereql.core.utils.ValidationResult;

/**
 * Checks the shape of an operator operand.
 * <p>
 * Validators are pure: they look at the decoded JSON value, and either accept it
 * (possibly converted, e.g. an ISO date string into a temporal) or describe why it
 * was refused.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface ValueValidator {

    /**
     * @param value the operand as decoded from JSON, possibly {@code null}
     * @return the accepted value or a failure
     */
    ValidationResult<Object> validate(Object value);
}
