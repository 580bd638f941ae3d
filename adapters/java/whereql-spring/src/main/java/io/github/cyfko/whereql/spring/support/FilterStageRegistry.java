package io.github.cyfko.whereql.spring.support;

import io.github.cyfko.whereql.core.api.Dataset;
import io.github.cyfko.whereql.core.compiler.ConditionCompiler;
import io.github.cyfko.whereql.core.config.QueryPolicy;
import io.github.cyfko.whereql.core.exception.FilterRejectedException;
import io.github.cyfko.whereql.core.pipeline.FilterAcceptance;
import io.github.cyfko.whereql.core.pipeline.FilterDocumentReader;
import io.github.cyfko.whereql.core.pipeline.QueryFilterStage;
import jakarta.servlet.http.HttpServletRequest;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/**
 * Registry of the filter stages of an application, one per endpoint.
 * <p>
 * An endpoint is any name the application chooses, typically the collection it lists
 * ({@code "samples"}). Registering it fixes its filterable fields; they can later be
 * replaced as a whole, for instance when an administrator changes what clients may filter
 * on. Requests in flight keep the set they started with.
 * </p>
 *
 * <h2>Usage Context</h2>
 * <pre>{@code
 * @GetMapping("/samples")
 * List<Sample> list(HttpServletRequest request) {
 *     return registry.filter("samples", request, JpaDataset.of(Sample.class)).getResultList(em);
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Registration, replacement and filtering may run concurrently.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterStageRegistry {

    private static final Logger logger = Logger.getLogger(FilterStageRegistry.class.getName());

    private final ConcurrentMap<String, QueryFilterStage> stages = new ConcurrentHashMap<>();
    private final QueryPolicy policy;
    private final ConditionCompiler compiler;
    private final FilterDocumentReader reader;

    /**
     * @param policy   parameter name shared by every endpoint
     * @param compiler compiler shared by every endpoint
     * @param reader   document reader shared by every endpoint
     */
    public FilterStageRegistry(QueryPolicy policy, ConditionCompiler compiler, FilterDocumentReader reader) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    /**
     * Registers an endpoint.
     *
     * @param endpoint endpoint name
     * @param fields   the fields clients may filter on
     * @return the endpoint's stage
     * @throws IllegalStateException if the endpoint is already registered
     */
    public QueryFilterStage register(String endpoint, Collection<String> fields) {
        Objects.requireNonNull(endpoint, "endpoint");
        QueryFilterStage stage = new QueryFilterStage(new FilterAcceptance(fields), policy, compiler, reader);
        if (stages.putIfAbsent(endpoint, stage) != null) {
            throw new IllegalStateException("Endpoint already registered: " + endpoint);
        }
        logger.fine(() -> "Registered filter endpoint " + endpoint + " on fields " + stage.acceptance().snapshot());
        return stage;
    }

    /**
     * Replaces the filterable fields of an endpoint.
     *
     * @param endpoint endpoint name
     * @param fields   the new filterable fields
     * @throws IllegalArgumentException if the endpoint is not registered
     */
    public void replaceFields(String endpoint, Collection<String> fields) {
        stage(endpoint).acceptance().replace(fields);
    }

    /**
     * @param endpoint endpoint name
     * @return the endpoint's stage
     * @throws IllegalArgumentException if the endpoint is not registered
     */
    public QueryFilterStage stage(String endpoint) {
        QueryFilterStage stage = stages.get(endpoint);
        if (stage == null) {
            throw new IllegalArgumentException("No filter endpoint registered under " + endpoint);
        }
        return stage;
    }

    public boolean hasStage(String endpoint) {
        return stages.containsKey(endpoint);
    }

    /**
     * Applies the request's filter parameter to a dataset.
     *
     * @param endpoint endpoint name
     * @param request  the current request
     * @param dataset  the dataset to narrow
     * @param <D>      dataset type
     * @return the narrowed dataset
     * @throws FilterRejectedException  if the filter parameter is invalid
     * @throws IllegalArgumentException if the endpoint is not registered
     */
    public <D extends Dataset<D>> D filter(String endpoint, HttpServletRequest request, D dataset) {
        QueryFilterStage stage = stage(endpoint);
        return stage.apply(request.getParameter(stage.parameterName()), dataset);
    }

    /**
     * Applies a filter found among already extracted query parameters.
     *
     * @see #filter(String, HttpServletRequest, Dataset)
     */
    public <D extends Dataset<D>> D filter(String endpoint, Map<String, String> queryParameters, D dataset) {
        return stage(endpoint).apply(queryParameters, dataset);
    }
}
