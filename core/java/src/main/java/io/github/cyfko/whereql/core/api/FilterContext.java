package io.github.cyfko.whereql.core.api;

import io.github.cyfko.whereql.core.operator.OperatorKind;
import io.github.cyfko.whereql.core.operator.QueryOperator;

/**
 * Bridge between validated filter terms and backend-specific conditions.
 * <p>
 * The compiler calls {@link #toCondition(String, QueryOperator, Object)} once per
 * field-level operator it meets in a filter document. By the time the call happens
 * the value has already passed the operator's validator, so implementations may rely
 * on its shape:
 * </p>
 * <ul>
 *   <li>ordering operators receive a {@link Number} or a {@link java.time.temporal.Temporal}</li>
 *   <li>{@code $in}/{@code $nin} receive a {@link java.util.List}</li>
 *   <li>{@code $exists} receives a {@link Boolean}</li>
 *   <li>geometry relations receive a {@link io.github.cyfko.whereql.core.geo.Geometry},
 *       {@code $geo.dwithin} a {@link io.github.cyfko.whereql.core.geo.GeoDistance}</li>
 *   <li>every other operator receives the raw JSON value, possibly {@code null}</li>
 * </ul>
 *
 * <h2>Field names</h2>
 * <p>
 * Field names reaching this method have already been checked against the endpoint's
 * allowed-field set. Resolving them to concrete attributes (columns, paths, document
 * keys) is the implementation's concern.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Implementations must be safe for concurrent use: the same context typically serves
 * every request hitting an endpoint.
 * </p>
 *
 * @see Condition
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FilterContext {

    /**
     * Builds the condition applying {@code operator} with {@code value} to {@code field}.
     *
     * @param field    name of the filtered field, never {@code null}
     * @param operator a {@link OperatorKind#GENERIC} operator
     * @param value    the validated operand
     * @return the field-level condition, never {@code null}
     * @throws IllegalArgumentException if the field cannot be resolved by this backend
     */
    Condition toCondition(String field, QueryOperator operator, Object value);
}
