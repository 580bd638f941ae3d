package io.github.cyfko.whereql.core.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.whereql.core.exception.FilterDocumentException;

import java.util.Map;
import java.util.Objects;

/**
 * Decodes the raw filter parameter into a filter document.
 * <p>
 * The parameter must hold a single JSON object. Objects decode to insertion-ordered
 * maps, arrays to lists, and scalars to {@link String}, {@link Boolean},
 * {@link Integer}/{@link Long}/{@link java.math.BigInteger}, {@link Double} or
 * {@code null}.
 * </p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterDocumentReader {

    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final int maxLength;

    /**
     * Reader using its own {@link ObjectMapper}.
     *
     * @param maxLength longest accepted input, in characters
     */
    public FilterDocumentReader(int maxLength) {
        this(new ObjectMapper(), maxLength);
    }

    /**
     * Reader sharing an application {@link ObjectMapper}. The mapper is copied, so the
     * stricter settings applied here do not leak back into the application.
     *
     * @param mapper    mapper providing factory settings
     * @param maxLength longest accepted input, in characters
     */
    public FilterDocumentReader(ObjectMapper mapper, int maxLength) {
        this.mapper = Objects.requireNonNull(mapper, "mapper").copy()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .disable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive, got: " + maxLength);
        }
        this.maxLength = maxLength;
    }

    /**
     * Decodes a filter parameter.
     *
     * @param raw the parameter value, already URL-decoded
     * @return the filter document
     * @throws FilterDocumentException if the input is too long, is not JSON, or is not an object
     */
    public Map<String, Object> read(String raw) {
        if (raw == null) {
            throw new FilterDocumentException("Filter is missing");
        }
        if (raw.length() > maxLength) {
            throw new FilterDocumentException("Filter exceeds " + maxLength + " characters");
        }
        try {
            JsonNode node = mapper.readTree(raw);
            if (node == null || !node.isObject()) {
                throw new FilterDocumentException("Filter must be a JSON object");
            }
            return mapper.convertValue(node, DOCUMENT);
        } catch (JsonProcessingException e) {
            throw new FilterDocumentException("Filter is not valid JSON", e);
        }
    }
}
