package io.github.cyfko.whereql.core.api;

/**
 * Backend-agnostic, composable boolean condition.
 * <p>
 * A {@code Condition} is what a compiled filter document turns into. Field-level
 * conditions are produced by a {@link FilterContext}; the compiler then glues them
 * together through {@link #and(Condition)}, {@link #or(Condition)} and {@link #not()}.
 * The interface follows the <strong>Composite pattern</strong>, so conditions can be
 * nested to any depth.
 * </p>
 *
 * <h2>Core Concepts</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> every operation returns a new {@code Condition},
 *       the receiver is left unchanged</li>
 *   <li><strong>Backend-Agnostic:</strong> nothing here assumes SQL, Criteria or any
 *       other query technology</li>
 *   <li><strong>Homogeneity:</strong> conditions are only combined with conditions
 *       coming from the same backend; implementations reject foreign instances</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Condition adult = context.toCondition("age", QueryOperator.GTE, 18);
 * Condition active = context.toCondition("status", QueryOperator.EQ, "ACTIVE");
 * Condition banned = context.toCondition("banned", QueryOperator.EQ, true);
 *
 * // age >= 18 AND status = 'ACTIVE' AND NOT(banned = true)
 * Condition combined = adult.and(active).and(banned.not());
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Implementations must be immutable and therefore safe to share between threads.
 * </p>
 *
 * @see FilterContext
 * @see Dataset
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface Condition {

    /**
     * Creates a new condition representing the logical AND of this condition and another.
     *
     * @param other the other condition to combine with this one
     * @return a new condition representing (this AND other)
     * @throws IllegalArgumentException if the other condition comes from another backend
     */
    Condition and(Condition other);

    /**
     * Creates a new condition representing the logical OR of this condition and another.
     *
     * @param other the other condition to combine with this one
     * @return a new condition representing (this OR other)
     * @throws IllegalArgumentException if the other condition comes from another backend
     */
    Condition or(Condition other);

    /**
     * Creates a new condition representing the logical negation of this condition.
     *
     * @return a new condition representing NOT(this)
     */
    Condition not();
}
