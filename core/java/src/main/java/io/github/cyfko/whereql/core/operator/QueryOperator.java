package io.github.cyfko.whereql.core.operator;

import io.github.cyfko.whereql.core.utils.ValidationResult;

import java.util.Optional;

/**
 * Enumeration of the operators understood in filter documents.
 * <p>
 * Each operator is identified by its wire token (the {@code $}-prefixed key clients
 * write), belongs to an {@link OperatorKind} deciding how the compiler builds it, and
 * owns the {@link ValueValidator} its operand must pass.
 * </p>
 *
 * <p><strong>Operator Categories and Examples:</strong></p>
 *
 * <p><em>Logical operators:</em></p>
 * <pre>{@code
 * {"$and": [{"a": 1}, {"b": 2}]}        -> AND, GLUE
 * {"$or":  [{"a": 1}, {"b": 2}]}        -> OR, GLUE
 * {"$not": {"a": 1}}                    -> NOT, NEGATION
 * }</pre>
 *
 * <p><em>Comparison operators:</em></p>
 * <pre>{@code
 * {"age": {"$eq": 25}}     -> EQ        {"age": {"$ne": 25}}    -> NE
 * {"age": {"$gt": 18}}     -> GT        {"age": {"$gte": 18}}   -> GTE (alias $ge)
 * {"age": {"$lt": 65}}     -> LT        {"age": {"$lte": 65}}   -> LTE (alias $le)
 * }</pre>
 *
 * <p><em>Membership, existence and text matching:</em></p>
 * <pre>{@code
 * {"status": {"$in": ["A", "B"]}}          -> IN
 * {"status": {"$nin": ["C"]}}              -> NIN
 * {"email": {"$exists": true}}             -> EXISTS
 * {"name": {"$contains": "jo"}}            -> CONTAINS (ICONTAINS ignores case)
 * {"name": {"$like": "Jo%"}}               -> LIKE (ILIKE ignores case)
 * {"name": {"$regex": "oh"}}              -> REGEX, a substring match like CONTAINS (IREGEX ignores case)
 * }</pre>
 *
 * <p><em>Geometry relations:</em></p>
 * <pre>{@code
 * {"area": {"$geo.contains": {"type": "point", "coordinates": [1, 2]}}}
 * {"area": {"$geo.dwithin": {"geometry": {"type": "point", "coordinates": [1, 2]}, "distance": 50}}}
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see OperatorTable
 */
public enum QueryOperator {

    AND("$and", OperatorKind.GLUE, OperatorValidators::glue),
    OR("$or", OperatorKind.GLUE, OperatorValidators::glue),
    NOT("$not", OperatorKind.NEGATION, OperatorValidators::mapping),

    EQ("$eq", OperatorKind.GENERIC, OperatorValidators::passThrough),
    NE("$ne", OperatorKind.GENERIC, OperatorValidators::passThrough),
    LT("$lt", OperatorKind.GENERIC, OperatorValidators::ordered),
    GT("$gt", OperatorKind.GENERIC, OperatorValidators::ordered),
    LE("$le", OperatorKind.GENERIC, OperatorValidators::ordered),
    GE("$ge", OperatorKind.GENERIC, OperatorValidators::ordered),
    LTE("$lte", OperatorKind.GENERIC, OperatorValidators::ordered),
    GTE("$gte", OperatorKind.GENERIC, OperatorValidators::ordered),

    IN("$in", OperatorKind.GENERIC, OperatorValidators::list),
    NIN("$nin", OperatorKind.GENERIC, OperatorValidators::list),
    EXISTS("$exists", OperatorKind.GENERIC, OperatorValidators::bool),

    CONTAINS("$contains", OperatorKind.GENERIC, OperatorValidators::passThrough),
    ICONTAINS("$icontains", OperatorKind.GENERIC, OperatorValidators::passThrough),
    LIKE("$like", OperatorKind.GENERIC, OperatorValidators::passThrough),
    ILIKE("$ilike", OperatorKind.GENERIC, OperatorValidators::passThrough),
    REGEX("$regex", OperatorKind.GENERIC, OperatorValidators::passThrough),
    IREGEX("$iregex", OperatorKind.GENERIC, OperatorValidators::passThrough),

    GEO_CONTAINS("$geo.contains", OperatorKind.GENERIC, OperatorValidators::geometry),
    GEO_EQUALS("$geo.equals", OperatorKind.GENERIC, OperatorValidators::geometry),
    GEO_INTERSECTS("$geo.intersects", OperatorKind.GENERIC, OperatorValidators::geometry),
    GEO_OVERLAPS("$geo.overlaps", OperatorKind.GENERIC, OperatorValidators::geometry),
    GEO_TOUCHES("$geo.touches", OperatorKind.GENERIC, OperatorValidators::geometry),
    GEO_WITHIN("$geo.within", OperatorKind.GENERIC, OperatorValidators::geometry),
    GEO_DWITHIN("$geo.dwithin", OperatorKind.GENERIC, OperatorValidators::geoDistance);

    private final String token;
    private final OperatorKind kind;
    private final ValueValidator validator;

    QueryOperator(String token, OperatorKind kind, ValueValidator validator) {
        this.token = token;
        this.kind = kind;
        this.validator = validator;
    }

    /**
     * @return the wire token, e.g. {@code $gte}
     */
    public String token() {
        return token;
    }

    /**
     * @return how the compiler builds this operator
     */
    public OperatorKind kind() {
        return kind;
    }

    /**
     * @return the validator its operand must pass
     */
    public ValueValidator validator() {
        return validator;
    }

    /**
     * Validates an operand for this operator.
     *
     * @param value the operand as decoded from JSON
     * @return the accepted (possibly converted) operand, or a failure
     */
    public ValidationResult<Object> validate(Object value) {
        return validator.validate(value);
    }

    /**
     * Folds aliases onto a single operator: {@link #LE} becomes {@link #LTE} and
     * {@link #GE} becomes {@link #GTE}. Every other operator is its own canonical form.
     *
     * @return the canonical operator
     */
    public QueryOperator canonical() {
        return switch (this) {
            case LE -> LTE;
            case GE -> GTE;
            default -> this;
        };
    }

    /**
     * @return {@code true} for the {@code $geo.*} relations
     */
    public boolean isGeometric() {
        return token.startsWith("$geo.");
    }

    /**
     * Finds an operator by its exact wire token.
     *
     * @param token the key found in a filter document
     * @return the operator, or empty if the token is not an operator
     */
    public static Optional<QueryOperator> fromToken(String token) {
        return OperatorTable.standard().find(token);
    }

    @Override
    public String toString() {
        return token;
    }
}
