package io.github.cyfko.whereql.core.pipeline;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.whereql.core.exception.FilterDocumentException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FilterDocumentReaderTest {

    private final FilterDocumentReader reader = new FilterDocumentReader(256);

    @Test
    void decodesObjectsInDocumentOrder() {
        Map<String, Object> document = reader.read("{\"z\": 1, \"a\": {\"$in\": [1, 2.5, \"x\", null, true]}, \"m\": 3}");

        assertEquals(List.of("z", "a", "m"), List.copyOf(document.keySet()));
        assertEquals(Map.of("$in", Arrays.asList(1, 2.5, "x", null, true)), document.get("a"));
    }

    @Test
    void floatsAreDoublesEvenWithABigDecimalMapper() {
        ObjectMapper application = new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        FilterDocumentReader shared = new FilterDocumentReader(application, 256);

        assertEquals(3.2, shared.read("{\"f\": 3.2}").get("f"));
        assertTrue(application.isEnabled(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS));
    }

    @Test
    void refusesNonObjects() {
        assertThrows(FilterDocumentException.class, () -> reader.read("[]"));
        assertThrows(FilterDocumentException.class, () -> reader.read("1"));
        assertThrows(FilterDocumentException.class, () -> reader.read("null"));
        assertThrows(FilterDocumentException.class, () -> reader.read(""));
        assertThrows(FilterDocumentException.class, () -> reader.read(null));
    }

    @Test
    void refusesMalformedJson() {
        FilterDocumentException e = assertThrows(FilterDocumentException.class, () -> reader.read("{not json"));
        assertNotNull(e.getCause());
        assertThrows(FilterDocumentException.class, () -> reader.read("{} {}"));
        assertThrows(FilterDocumentException.class, () -> reader.read("{'a': 1}"));
    }

    @Test
    void refusesOversizedInput() {
        String big = "{\"a\": \"" + "x".repeat(300) + "\"}";
        FilterDocumentException e = assertThrows(FilterDocumentException.class, () -> reader.read(big));
        assertEquals("Filter exceeds 256 characters", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> new FilterDocumentReader(0));
    }
}
