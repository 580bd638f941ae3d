package io.github.cyfko.whereql.core.operator;

import io.github.cyfko.whereql.core.geo.GeometryDecoder;
import io.github.cyfko.whereql.core.utils.ValidationResult;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.Temporal;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * The operand validators behind {@link QueryOperator}.
 * <p>
 * Every method here is a {@link ValueValidator}: it never throws for a bad operand and
 * reports the problem through {@link ValidationResult#failure(String)} instead.
 * </p>
 *
 * <table>
 *   <caption>Operand shapes</caption>
 *   <tr><th>Validator</th><th>Accepts</th></tr>
 *   <tr><td>{@link #glue}</td><td>a list of maps</td></tr>
 *   <tr><td>{@link #mapping}</td><td>a map</td></tr>
 *   <tr><td>{@link #passThrough}</td><td>anything, unchanged</td></tr>
 *   <tr><td>{@link #list}</td><td>a list</td></tr>
 *   <tr><td>{@link #ordered}</td><td>a number, a temporal or an ISO-8601 date/time string</td></tr>
 *   <tr><td>{@link #bool}</td><td>a boolean</td></tr>
 *   <tr><td>{@link #geometry}</td><td>a {@code {type, coordinates}} literal</td></tr>
 *   <tr><td>{@link #geoDistance}</td><td>a {@code {geometry, distance}} literal</td></tr>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class OperatorValidators {

    private static final List<Function<String, Temporal>> TEMPORAL_PARSERS = List.of(
            OffsetDateTime::parse,
            LocalDateTime::parse,
            LocalDate::parse
    );

    private OperatorValidators() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ValidationResult<Object> glue(Object value) {
        if (!(value instanceof List<?> elements)) {
            return ValidationResult.failure("Expected a list of filter documents");
        }
        for (Object element : elements) {
            if (!(element instanceof Map<?, ?>)) {
                return ValidationResult.failure("Expected a filter document, got: " + element);
            }
        }
        return ValidationResult.success(value);
    }

    public static ValidationResult<Object> mapping(Object value) {
        return value instanceof Map<?, ?>
                ? ValidationResult.success(value)
                : ValidationResult.failure("Expected a filter document");
    }

    public static ValidationResult<Object> passThrough(Object value) {
        return ValidationResult.success(value);
    }

    public static ValidationResult<Object> list(Object value) {
        return value instanceof List<?>
                ? ValidationResult.success(value)
                : ValidationResult.failure("Expected a list");
    }

    public static ValidationResult<Object> bool(Object value) {
        return value instanceof Boolean
                ? ValidationResult.success(value)
                : ValidationResult.failure("Expected a boolean");
    }

    /**
     * Accepts values that can be ordered: numbers, temporals, and strings holding an
     * ISO-8601 offset date-time, local date-time or local date. Strings are converted
     * to the first temporal type that parses them.
     */
    public static ValidationResult<Object> ordered(Object value) {
        if (value instanceof Number || value instanceof Temporal) {
            return ValidationResult.success(value);
        }
        if (value instanceof String text) {
            for (Function<String, Temporal> parser : TEMPORAL_PARSERS) {
                try {
                    return ValidationResult.success(parser.apply(text));
                } catch (DateTimeParseException ignored) {
                    // next format
                }
            }
        }
        return ValidationResult.failure("Expected a number or an ISO-8601 date/time");
    }

    public static ValidationResult<Object> geometry(Object value) {
        return GeometryDecoder.decode(value).map(Object.class::cast);
    }

    public static ValidationResult<Object> geoDistance(Object value) {
        return GeometryDecoder.decodeDistance(value).map(Object.class::cast);
    }
}
