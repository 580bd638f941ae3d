package io.github.cyfko.whereql.core.config;

/**
 * Configuration of filter decoding and compilation limits.
 * <p>
 * The policy names the query parameter carrying the filter document and bounds what a
 * client may send, protecting the compiler against oversized or pathologically nested
 * documents.
 * </p>
 *
 * <h2>Predefined policies</h2>
 * <ul>
 *   <li>{@link #defaults()}: parameter {@code where}, depth 32, 8192 characters</li>
 *   <li>{@link #strict()}: parameter {@code where}, depth 8, 2048 characters; suited to public APIs</li>
 * </ul>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * QueryPolicy policy = QueryPolicy.builder()
 *     .parameterName("filter")
 *     .maxDepth(16)
 *     .build();
 * }</pre>
 *
 * @param parameterName   name of the query parameter holding the JSON filter
 * @param maxDepth        maximum nesting of filter documents, counted in compiled levels
 * @param maxFilterLength maximum length of the raw parameter, in characters
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record QueryPolicy(
        String parameterName,
        int maxDepth,
        int maxFilterLength
) {

    /** Query parameter name used when none is configured. */
    public static final String DEFAULT_PARAMETER = "where";

    public QueryPolicy {
        if (parameterName == null || parameterName.isBlank()) {
            throw new IllegalArgumentException("parameterName is required");
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        if (maxFilterLength <= 0) {
            throw new IllegalArgumentException("maxFilterLength must be positive, got: " + maxFilterLength);
        }
    }

    /**
     * @return balanced limits for most deployments
     */
    public static QueryPolicy defaults() {
        return new QueryPolicy(DEFAULT_PARAMETER, 32, 8192);
    }

    /**
     * @return tight limits for endpoints exposed to untrusted clients
     */
    public static QueryPolicy strict() {
        return new QueryPolicy(DEFAULT_PARAMETER, 8, 2048);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _parameterName = DEFAULT_PARAMETER;
        private int _maxDepth = 32;
        private int _maxFilterLength = 8192;

        private Builder() {}

        public QueryPolicy build() {
            return new QueryPolicy(_parameterName, _maxDepth, _maxFilterLength);
        }

        public Builder parameterName(String parameterName) { this._parameterName = parameterName; return this; }
        public Builder maxDepth(int maxDepth) { this._maxDepth = maxDepth; return this; }
        public Builder maxFilterLength(int maxFilterLength) { this._maxFilterLength = maxFilterLength; return this; }
    }
}
