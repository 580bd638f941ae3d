package io.github.cyfko.whereql.core.utils;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class ValidationResultTest {

    @Test
    void success() {
        ValidationResult<String> result = ValidationResult.success("a");
        assertTrue(result.isValid());
        assertEquals("a", result.getValue());
        assertNull(result.getErrorMessage());
        assertEquals(1, result.map(String::length).getValue());
    }

    @Test
    void failure() {
        ValidationResult<String> result = ValidationResult.failure("Expected a list");
        assertFalse(result.isValid());
        assertEquals("Expected a list", result.getErrorMessage());
        assertThrows(IllegalStateException.class, result::getValue);
        assertEquals("Expected a list", result.map(String::length).getErrorMessage());
        assertThrows(NullPointerException.class, () -> ValidationResult.failure(null));
    }

    @Test
    void successMayHoldNull() {
        assertNull(ValidationResult.success(null).getValue());
    }

    @Test
    void rendersJson() {
        assertEquals("[1,\"a\",null]", JsonValues.render(Arrays.asList(1, "a", null)));
        assertEquals("true", JsonValues.render(true));
    }
}
