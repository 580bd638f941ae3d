package io.github.cyfko.whereql.spring.autoconfigure;

import io.github.cyfko.whereql.core.config.QueryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code whereql.*} configuration properties.
 *
 * <pre>
 * whereql.parameter-name=where
 * whereql.max-depth=32
 * whereql.max-filter-length=8192
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "whereql")
public class WhereQlProperties {

    private String parameterName = QueryPolicy.DEFAULT_PARAMETER;
    private int maxDepth = QueryPolicy.defaults().maxDepth();
    private int maxFilterLength = QueryPolicy.defaults().maxFilterLength();

    public String getParameterName() { return parameterName; }
    public void setParameterName(String parameterName) { this.parameterName = parameterName; }

    public int getMaxDepth() { return maxDepth; }
    public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }

    public int getMaxFilterLength() { return maxFilterLength; }
    public void setMaxFilterLength(int maxFilterLength) { this.maxFilterLength = maxFilterLength; }

    /**
     * @return the policy described by these properties
     * @throws IllegalArgumentException if a property is out of range
     */
    public QueryPolicy toPolicy() {
        return QueryPolicy.builder()
                .parameterName(parameterName)
                .maxDepth(maxDepth)
                .maxFilterLength(maxFilterLength)
                .build();
    }
}
