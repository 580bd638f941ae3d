package io.github.cyfko.whereql.jpa;

import io.github.cyfko.whereql.core.api.Condition;
import io.github.cyfko.whereql.core.api.FilterContext;
import io.github.cyfko.whereql.core.geo.GeoDistance;
import io.github.cyfko.whereql.core.geo.Geometry;
import io.github.cyfko.whereql.core.operator.OperatorKind;
import io.github.cyfko.whereql.core.operator.QueryOperator;
import io.github.cyfko.whereql.jpa.utils.AttributePaths;
import io.github.cyfko.whereql.jpa.utils.ValueConversions;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * JPA Criteria API implementation of {@link FilterContext}.
 * <p>
 * Each field-level condition of a compiled filter becomes a {@link JpaCondition} whose
 * resolver, once the query is assembled:
 * </p>
 * <ol>
 *   <li>maps the filter field to an attribute path (identity unless a mapping is given;
 *       dotted paths join associations, see {@link AttributePaths})</li>
 *   <li>converts the operand to the attribute's Java type ({@link ValueConversions})</li>
 *   <li>builds the operator's predicate with the {@link CriteriaBuilder}</li>
 * </ol>
 *
 * <h2>Operator translation</h2>
 * <table>
 *   <caption>Predicates built per operator</caption>
 *   <tr><th>Operator</th><th>Predicate</th></tr>
 *   <tr><td>{@code $eq}, {@code $ne}</td><td>{@code =}, {@code <>}; {@code IS NULL}, {@code IS NOT NULL} for a null operand</td></tr>
 *   <tr><td>{@code $lt}, {@code $lte}/{@code $le}, {@code $gt}, {@code $gte}/{@code $ge}</td><td>{@code <}, {@code <=}, {@code >}, {@code >=}</td></tr>
 *   <tr><td>{@code $in}, {@code $nin}</td><td>{@code IN}, {@code NOT IN}; always false, always true when empty</td></tr>
 *   <tr><td>{@code $exists}</td><td>{@code IS NOT NULL} when true, {@code IS NULL} when false</td></tr>
 *   <tr><td>{@code $contains}, {@code $icontains}, {@code $regex}, {@code $iregex}</td><td>{@code LIKE '%v%'} with
 *       wildcards of {@code v} escaped; {@code lower()} on both sides for the i-variants</td></tr>
 *   <tr><td>{@code $like}, {@code $ilike}</td><td>{@code LIKE v}; {@code lower()} on both sides for the i-variant</td></tr>
 *   <tr><td>text operators</td><td>{@code IS NULL} for a null operand</td></tr>
 *   <tr><td>{@code $geo.*}</td><td>{@code ST_Contains}, {@code ST_Equals}, {@code ST_Intersects}, {@code ST_Overlaps},
 *       {@code ST_Touches}, {@code ST_Within} against {@code ST_GeomFromText(wkt[, srid])}</td></tr>
 *   <tr><td>{@code $geo.dwithin}</td><td>{@code ST_DWithin(path, geometry, distance)}</td></tr>
 * </table>
 * <p>
 * Spatial functions are passed to the database as written; the database (H2GIS,
 * PostgreSQL/PostGIS, MySQL, Oracle...) must provide them.
 * </p>
 *
 * <h2>Usage example</h2>
 * <pre>{@code
 * JpaFilterContext<Sample> context = new JpaFilterContext<>(Map.of("int", "number", "owner", "owner.name"));
 * JpaDataset<Sample> samples = JpaDataset.of(Sample.class, context);
 * List<Sample> result = stage.apply(queryParameters, samples).getResultList(entityManager);
 * }</pre>
 *
 * @param <E> the entity type
 * @author Frank KOSSI
 * @since 1.0.0
 * @see JpaCondition
 * @see JpaDataset
 */
public class JpaFilterContext<E> implements FilterContext {

    private static final Logger logger = Logger.getLogger(JpaFilterContext.class.getName());

    private static final char ESCAPE = '\\';

    private final Function<String, String> pathMapping;
    private final Integer srid;

    /**
     * Context using filter field names as attribute paths.
     */
    public JpaFilterContext() {
        this(Function.identity(), null);
    }

    /**
     * Context renaming some fields; fields absent from {@code paths} are used as they are.
     *
     * @param paths attribute path per filter field
     */
    public JpaFilterContext(Map<String, String> paths) {
        this(mappingOf(paths), null);
    }

    /**
     * @param pathMapping maps a filter field to an attribute path
     * @param srid        spatial reference id passed to {@code ST_GeomFromText}, or {@code null} to omit it
     */
    public JpaFilterContext(Function<String, String> pathMapping, Integer srid) {
        this.pathMapping = Objects.requireNonNull(pathMapping, "pathMapping cannot be null");
        this.srid = srid;
    }

    /**
     * @param srid spatial reference id of the geometry columns
     * @return a context equal to this one, with geometry literals tagged with {@code srid}
     */
    public JpaFilterContext<E> withSrid(int srid) {
        return new JpaFilterContext<>(pathMapping, srid);
    }

    /**
     * {@inheritDoc}
     *
     * @return a {@link JpaCondition} resolving the predicate when the query is assembled
     * @throws IllegalArgumentException if {@code operator} is not a field operator
     */
    @Override
    public Condition toCondition(String field, QueryOperator operator, Object value) {
        Objects.requireNonNull(field, "field cannot be null");
        if (operator.kind() != OperatorKind.GENERIC) {
            throw new IllegalArgumentException(operator + " is not a field operator");
        }
        String pathName = Objects.requireNonNull(pathMapping.apply(field), "No attribute path for field " + field);
        QueryOperator canonical = operator.canonical();
        logger.fine(() -> "Condition " + field + " (" + pathName + ") " + canonical);

        PredicateResolver<E> resolver = (root, query, cb) ->
                buildPredicate(cb, AttributePaths.resolve(root, pathName), canonical, value);
        return new JpaCondition<>(resolver);
    }

    private Predicate buildPredicate(CriteriaBuilder cb, Path<?> path, QueryOperator operator, Object value) {
        Class<?> javaType = path.getJavaType();

        return switch (operator) {
            case EQ -> value == null ? cb.isNull(path) : cb.equal(path, ValueConversions.convertValue(javaType, value));
            case NE -> value == null ? cb.isNotNull(path) : cb.notEqual(path, ValueConversions.convertValue(javaType, value));
            case LT, LTE, GT, GTE -> compare(cb, path, operator, ValueConversions.convertValue(javaType, value));

            case IN -> {
                List<Object> values = ValueConversions.convertAll(javaType, (Collection<?>) value);
                yield values.isEmpty() ? cb.disjunction() : path.in(values);
            }
            case NIN -> {
                List<Object> values = ValueConversions.convertAll(javaType, (Collection<?>) value);
                yield values.isEmpty() ? cb.conjunction() : cb.not(path.in(values));
            }
            case EXISTS -> Boolean.TRUE.equals(value) ? cb.isNotNull(path) : cb.isNull(path);

            case CONTAINS, REGEX -> value == null ? cb.isNull(path)
                    : contains(cb, text(path), String.valueOf(value));
            case ICONTAINS, IREGEX -> value == null ? cb.isNull(path)
                    : contains(cb, cb.lower(text(path)), String.valueOf(value).toLowerCase(Locale.ROOT));
            case LIKE -> value == null ? cb.isNull(path) : cb.like(text(path), String.valueOf(value));
            case ILIKE -> value == null ? cb.isNull(path)
                    : cb.like(cb.lower(text(path)), String.valueOf(value).toLowerCase(Locale.ROOT));

            case GEO_CONTAINS -> spatial(cb, "ST_Contains", path, (Geometry) value);
            case GEO_EQUALS -> spatial(cb, "ST_Equals", path, (Geometry) value);
            case GEO_INTERSECTS -> spatial(cb, "ST_Intersects", path, (Geometry) value);
            case GEO_OVERLAPS -> spatial(cb, "ST_Overlaps", path, (Geometry) value);
            case GEO_TOUCHES -> spatial(cb, "ST_Touches", path, (Geometry) value);
            case GEO_WITHIN -> spatial(cb, "ST_Within", path, (Geometry) value);
            case GEO_DWITHIN -> {
                GeoDistance distance = (GeoDistance) value;
                yield cb.isTrue(cb.function("ST_DWithin", Boolean.class,
                        path, geometry(cb, distance.geometry()), cb.literal(distance.distance())));
            }

            default -> throw new IllegalArgumentException("Unsupported operator: " + operator);
        };
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Predicate compare(CriteriaBuilder cb, Path<?> path, QueryOperator operator, Object value) {
        Expression<Comparable> expression = (Expression<Comparable>) path;
        Comparable operand = (Comparable) value;
        return switch (operator) {
            case LT -> cb.lessThan(expression, operand);
            case LTE -> cb.lessThanOrEqualTo(expression, operand);
            case GT -> cb.greaterThan(expression, operand);
            case GTE -> cb.greaterThanOrEqualTo(expression, operand);
            default -> throw new IllegalArgumentException("Not an ordering operator: " + operator);
        };
    }

    private static Predicate contains(CriteriaBuilder cb, Expression<String> text, String fragment) {
        return cb.like(text, "%" + escapeLike(fragment) + "%", ESCAPE);
    }

    private Predicate spatial(CriteriaBuilder cb, String function, Path<?> path, Geometry geometry) {
        return cb.isTrue(cb.function(function, Boolean.class, path, geometry(cb, geometry)));
    }

    private Expression<?> geometry(CriteriaBuilder cb, Geometry geometry) {
        List<Expression<?>> arguments = new ArrayList<>(2);
        arguments.add(cb.literal(geometry.toWkt()));
        if (srid != null) {
            arguments.add(cb.literal(srid));
        }
        return cb.function("ST_GeomFromText", Object.class, arguments.toArray(new Expression<?>[0]));
    }

    @SuppressWarnings("unchecked")
    private static Expression<String> text(Path<?> path) {
        if (path.getJavaType() != String.class) {
            return ((Expression<Object>) path).as(String.class);
        }
        return (Expression<String>) path;
    }

    static String escapeLike(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == ESCAPE || c == '%' || c == '_') {
                escaped.append(ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private static Function<String, String> mappingOf(Map<String, String> paths) {
        Map<String, String> copy = Map.copyOf(Objects.requireNonNull(paths, "paths cannot be null"));
        return field -> copy.getOrDefault(field, field);
    }
}
