package io.github.cyfko.whereql.jpa.utils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Converts filter operands to the Java type of the attribute they are compared with.
 * <p>
 * Operands come out of JSON decoding and operand validation, so they are strings,
 * booleans, numbers, {@code java.time} values or lists of those. Attributes may be any
 * basic JPA type; this class bridges the two.
 * </p>
 *
 * <h2>Supported targets</h2>
 * <ul>
 *   <li>numbers, primitive or boxed, {@link BigDecimal}, {@link BigInteger}</li>
 *   <li>{@link String}, {@link Boolean}, {@link UUID}, enums (exact name first, then ignoring case)</li>
 *   <li>{@link LocalDate}, {@link LocalDateTime}, {@link LocalTime}, {@link OffsetDateTime},
 *       {@link ZonedDateTime}, {@link Instant}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValueConversions {

    private ValueConversions() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Converts a single operand.
     *
     * @param targetType the attribute type
     * @param value      the operand, possibly {@code null}
     * @return the converted operand, {@code null} for a {@code null} operand
     * @throws IllegalArgumentException if the operand cannot represent a value of {@code targetType}
     */
    public static Object convertValue(Class<?> targetType, Object value) {
        if (value == null) {
            return null;
        }
        if (targetType.isInstance(value)) {
            return value;
        }

        try {
            if (targetType == BigDecimal.class) return new BigDecimal(value.toString());
            if (targetType == BigInteger.class) return new BigInteger(value.toString());

            if (Number.class.isAssignableFrom(targetType) || isNumericPrimitive(targetType)) {
                return convertToNumeric(targetType, value);
            }
            if (targetType.isEnum()) {
                return convertToEnum(targetType, value);
            }
            if (targetType == Boolean.class || targetType == boolean.class) {
                return convertToBoolean(value);
            }

            if (targetType == LocalDate.class) return convertToLocalDate(value);
            if (targetType == LocalDateTime.class) return convertToLocalDateTime(value);
            if (targetType == LocalTime.class) return LocalTime.parse(value.toString());
            if (targetType == OffsetDateTime.class) return convertToOffsetDateTime(value);
            if (targetType == ZonedDateTime.class) return convertToOffsetDateTime(value).toZonedDateTime();
            if (targetType == Instant.class) return convertToOffsetDateTime(value).toInstant();

            if (targetType == UUID.class) return UUID.fromString(value.toString());
            if (targetType == String.class) return value.toString();
        } catch (RuntimeException e) {
            throw new IllegalArgumentException(
                    String.format("Error converting value '%s' to type %s: %s",
                            value, targetType.getName(), e.getMessage()), e
            );
        }

        throw new IllegalArgumentException(
                String.format("Cannot convert value '%s' (type: %s) to target type %s",
                        value, value.getClass().getName(), targetType.getName())
        );
    }

    /**
     * Converts every element of a list operand.
     *
     * @param elementType the attribute type
     * @param values      the list operand
     * @return a new list of converted elements
     * @throws IllegalArgumentException if an element cannot be converted
     */
    public static List<Object> convertAll(Class<?> elementType, Collection<?> values) {
        List<Object> result = new ArrayList<>(values.size());
        for (Object item : values) {
            result.add(convertValue(elementType, item));
        }
        return result;
    }

    private static boolean isNumericPrimitive(Class<?> type) {
        return type == int.class || type == long.class || type == double.class
                || type == float.class || type == short.class || type == byte.class;
    }

    private static Object convertToNumeric(Class<?> targetType, Object value) {
        if (value instanceof Boolean) {
            throw new IllegalArgumentException("A boolean is not a number");
        }
        if (value instanceof Number num) {
            if (targetType == Integer.class || targetType == int.class) return num.intValue();
            if (targetType == Long.class || targetType == long.class) return num.longValue();
            if (targetType == Double.class || targetType == double.class) return num.doubleValue();
            if (targetType == Float.class || targetType == float.class) return num.floatValue();
            if (targetType == Short.class || targetType == short.class) return num.shortValue();
            if (targetType == Byte.class || targetType == byte.class) return num.byteValue();
        }

        String str = value.toString();
        if (targetType == Integer.class || targetType == int.class) return Integer.valueOf(str);
        if (targetType == Long.class || targetType == long.class) return Long.valueOf(str);
        if (targetType == Double.class || targetType == double.class) return Double.valueOf(str);
        if (targetType == Float.class || targetType == float.class) return Float.valueOf(str);
        if (targetType == Short.class || targetType == short.class) return Short.valueOf(str);
        if (targetType == Byte.class || targetType == byte.class) return Byte.valueOf(str);

        throw new IllegalArgumentException("Unsupported numeric type: " + targetType);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object convertToEnum(Class<?> targetType, Object value) {
        Class<? extends Enum> enumClass = (Class<? extends Enum>) targetType;
        String name = value.toString();
        for (Enum<?> constant : enumClass.getEnumConstants()) {
            if (constant.name().equals(name)) {
                return constant;
            }
        }
        for (Enum<?> constant : enumClass.getEnumConstants()) {
            if (constant.name().equalsIgnoreCase(name)) {
                return constant;
            }
        }
        throw new IllegalArgumentException(
                String.format("Invalid value '%s' for enum %s", name, enumClass.getSimpleName()));
    }

    private static Boolean convertToBoolean(Object value) {
        if (value instanceof Boolean b) return b;
        String normalized = value.toString().trim();
        if ("true".equalsIgnoreCase(normalized)) return Boolean.TRUE;
        if ("false".equalsIgnoreCase(normalized)) return Boolean.FALSE;
        throw new IllegalArgumentException("Not a boolean: " + value);
    }

    private static LocalDate convertToLocalDate(Object value) {
        if (value instanceof LocalDateTime ldt) return ldt.toLocalDate();
        if (value instanceof OffsetDateTime odt) return odt.toLocalDate();
        return LocalDate.parse(value.toString());
    }

    private static LocalDateTime convertToLocalDateTime(Object value) {
        if (value instanceof LocalDate ld) return ld.atStartOfDay();
        if (value instanceof OffsetDateTime odt) return odt.atZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime();
        String text = value.toString();
        return text.length() == 10 ? LocalDate.parse(text).atStartOfDay() : LocalDateTime.parse(text);
    }

    private static OffsetDateTime convertToOffsetDateTime(Object value) {
        if (value instanceof Instant instant) return instant.atOffset(ZoneOffset.UTC);
        if (value instanceof Temporal && !(value instanceof OffsetDateTime)) {
            LocalDateTime local = convertToLocalDateTime(value);
            return local.atZone(ZoneId.systemDefault()).toOffsetDateTime();
        }
        return OffsetDateTime.parse(value.toString());
    }
}
