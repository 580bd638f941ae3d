package io.github.cyfko.whereql.spring.web;

import io.github.cyfko.whereql.core.exception.FilterRejectedException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.logging.Logger;

/**
 * Answers rejected filters with {@code 400 Bad Request} and a body of the form
 * {@code {"errors": {"where": "Invalid $in condition: \"x\""}}}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@RestControllerAdvice
public class FilterRejectionHandler {

    private static final Logger logger = Logger.getLogger(FilterRejectionHandler.class.getName());

    @ExceptionHandler(FilterRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleRejectedFilter(FilterRejectedException e) {
        logger.fine(() -> "Filter rejected with status " + e.getStatus() + ": " + e.getErrors());
        return ResponseEntity.status(e.getStatus()).body(e.toBody());
    }
}
