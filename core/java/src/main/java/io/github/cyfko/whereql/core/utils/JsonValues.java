package io.github.cyfko.whereql.core.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Helpers for echoing filter values back to clients.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class JsonValues {

    private static final ObjectMapper RENDERER = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private JsonValues() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Renders a decoded JSON value as compact JSON text.
     * <p>
     * Values that cannot be serialized fall back to {@link String#valueOf(Object)},
     * so the method never fails.
     * </p>
     *
     * @param value any value produced by JSON decoding, possibly {@code null}
     * @return the JSON representation of {@code value}
     */
    public static String render(Object value) {
        try {
            return RENDERER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
