package io.github.cyfko.whereql.core.geo;

import io.github.cyfko.whereql.core.utils.ValidationResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decodes geometry literals found in filter documents.
 * <p>
 * Two literal shapes are understood:
 * </p>
 * <pre>{@code
 * {"type": "point", "coordinates": [1, 2]}
 * {"geometry": {"type": "linestring", "coordinates": [[0, 0], [1, 1]]}, "distance": 10}
 * }</pre>
 * <p>
 * Decoding never throws: unknown kinds, malformed coordinates and arity mismatches all
 * come back as a failed {@link ValidationResult}, which the operator table turns into a
 * {@link io.github.cyfko.whereql.core.exception.QueryException} for the operator at hand.
 * </p>
 *
 * <p>This class is stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class GeometryDecoder {

    private static final Set<String> GEOMETRY_KEYS = Set.of("type", "coordinates");
    private static final Set<String> DISTANCE_KEYS = Set.of("geometry", "distance");

    private GeometryDecoder() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Decodes a {@code {type, coordinates}} literal.
     *
     * @param literal the decoded JSON value
     * @return the geometry, or a failure describing why the literal was refused
     */
    public static ValidationResult<Geometry> decode(Object literal) {
        if (!(literal instanceof Map<?, ?> map) || !GEOMETRY_KEYS.equals(map.keySet())) {
            return ValidationResult.failure("A geometry literal needs exactly the keys " + GEOMETRY_KEYS);
        }
        if (!(map.get("type") instanceof String type)) {
            return ValidationResult.failure("Geometry type must be a string");
        }
        GeometryKind kind = GeometryKind.fromName(type).orElse(null);
        if (kind == null) {
            return ValidationResult.failure("Unknown geometry type: " + type);
        }
        if (!(map.get("coordinates") instanceof List<?> coordinates)) {
            return ValidationResult.failure("Geometry coordinates must be a list");
        }

        List<?> tuple = toTuple(coordinates);
        if (tuple == null) {
            return ValidationResult.failure("Geometry coordinates must only contain numbers and lists");
        }
        try {
            return ValidationResult.success(kind.construct(tuple));
        } catch (IllegalArgumentException e) {
            return ValidationResult.failure(e.getMessage());
        }
    }

    /**
     * Decodes a {@code {geometry, distance}} literal.
     *
     * @param literal the decoded JSON value
     * @return the geometry paired with its distance, or a failure
     */
    public static ValidationResult<GeoDistance> decodeDistance(Object literal) {
        if (!(literal instanceof Map<?, ?> map) || !DISTANCE_KEYS.equals(map.keySet())) {
            return ValidationResult.failure("A distance literal needs exactly the keys " + DISTANCE_KEYS);
        }
        if (!(map.get("distance") instanceof Number distance) || !isTruthy(distance)) {
            return ValidationResult.failure("Distance must be a non-zero number");
        }
        ValidationResult<Geometry> geometry = decode(map.get("geometry"));
        if (!geometry.isValid()) {
            return ValidationResult.failure(geometry.getErrorMessage());
        }
        return ValidationResult.success(new GeoDistance(geometry.getValue(), distance.doubleValue()));
    }

    private static boolean isTruthy(Number number) {
        double value = number.doubleValue();
        return Double.isFinite(value) && value != 0;
    }

    /**
     * Converts nested lists of numbers into immutable lists of {@link Double}.
     *
     * @return the converted tuple, or {@code null} if a leaf is not a number
     */
    private static List<?> toTuple(List<?> values) {
        List<Object> tuple = new ArrayList<>(values.size());
        for (Object element : values) {
            if (element instanceof List<?> nested) {
                List<?> converted = toTuple(nested);
                if (converted == null) return null;
                tuple.add(converted);
            } else if (element instanceof Number number) {
                tuple.add(number.doubleValue());
            } else {
                return null;
            }
        }
        return Collections.unmodifiableList(tuple);
    }
}
