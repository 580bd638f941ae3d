package io.github.cyfko.whereql.core.exception;

/**
 * Thrown when a filter document nests deeper than the configured limit.
 * <p>
 * Deeply nested documents are the only way a client can make compilation expensive;
 * the compiler refuses them before recursing further instead of exhausting the stack.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see io.github.cyfko.whereql.core.config.QueryPolicy#maxDepth()
 */
public class FilterComplexityException extends QueryException {

    private final int maxDepth;

    /**
     * @param key      the key being compiled when the limit was hit
     * @param maxDepth the configured maximum depth
     */
    public FilterComplexityException(String key, int maxDepth) {
        super(key, null, "Filter nesting exceeds maximum depth of " + maxDepth);
        this.maxDepth = maxDepth;
    }

    /**
     * @return the depth limit that was exceeded
     */
    public int getMaxDepth() {
        return maxDepth;
    }
}
