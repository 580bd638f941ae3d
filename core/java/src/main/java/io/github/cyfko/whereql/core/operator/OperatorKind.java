package io.github.cyfko.whereql.core.operator;

/**
 * How an operator turns its operand into a condition.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum OperatorKind {

    /** Applies to the enclosing field through {@link io.github.cyfko.whereql.core.api.FilterContext}. */
    GENERIC,

    /** Combines a list of sub-documents ({@code $and}, {@code $or}). */
    GLUE,

    /** Negates a single sub-document ({@code $not}). */
    NEGATION
}
