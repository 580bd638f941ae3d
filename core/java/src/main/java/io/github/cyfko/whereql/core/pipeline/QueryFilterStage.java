package io.github.cyfko.whereql.core.pipeline;

import io.github.cyfko.whereql.core.api.Condition;
import io.github.cyfko.whereql.core.api.Dataset;
import io.github.cyfko.whereql.core.compiler.ConditionCompiler;
import io.github.cyfko.whereql.core.config.QueryPolicy;
import io.github.cyfko.whereql.core.exception.FilterDocumentException;
import io.github.cyfko.whereql.core.exception.FilterRejectedException;
import io.github.cyfko.whereql.core.exception.QueryException;
import io.github.cyfko.whereql.core.operator.OperatorTable;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Request-time entry point applying the filter parameter to a dataset.
 * <p>
 * One stage serves one endpoint: it owns the endpoint's {@link FilterAcceptance} and
 * runs, for every request:
 * </p>
 * <ol>
 *   <li>read the filter parameter ({@link QueryPolicy#parameterName()}); when it is
 *       absent or empty, or when no field is filterable, the dataset passes unchanged</li>
 *   <li>decode it as a JSON object; failure rejects the request with {@code "invalid value"}</li>
 *   <li>compile it with the dataset's {@link io.github.cyfko.whereql.core.api.FilterContext};
 *       a {@link QueryException} rejects the request with the exception's message</li>
 *   <li>narrow the dataset with the compiled condition, if any</li>
 * </ol>
 * <p>
 * Rejections are {@link FilterRejectedException}s: status 400 and body
 * {@code {"errors": {<parameter>: <message>}}}. A rejected filter is a client error and
 * is never retried.
 * </p>
 *
 * <pre>{@code
 * QueryFilterStage stage = new QueryFilterStage(FilterAcceptance.of("str", "int"));
 * ExpressionDataset filtered = stage.apply(Map.of("where", "{\"int\": {\"$gt\": 2}}"), dataset);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class QueryFilterStage {

    private static final Logger logger = Logger.getLogger(QueryFilterStage.class.getName());

    private final FilterAcceptance acceptance;
    private final String parameterName;
    private final ConditionCompiler compiler;
    private final FilterDocumentReader reader;

    /**
     * Stage with {@link QueryPolicy#defaults()} and the full operator vocabulary.
     *
     * @param acceptance the endpoint's filterable fields
     */
    public QueryFilterStage(FilterAcceptance acceptance) {
        this(acceptance, QueryPolicy.defaults());
    }

    /**
     * @param acceptance the endpoint's filterable fields
     * @param policy     parameter name and limits
     */
    public QueryFilterStage(FilterAcceptance acceptance, QueryPolicy policy) {
        this(acceptance, policy,
                new ConditionCompiler(OperatorTable.standard(), policy),
                new FilterDocumentReader(policy.maxFilterLength()));
    }

    /**
     * @param acceptance the endpoint's filterable fields
     * @param policy     parameter name
     * @param compiler   compiler shared between stages
     * @param reader     decoder shared between stages
     */
    public QueryFilterStage(FilterAcceptance acceptance, QueryPolicy policy,
                            ConditionCompiler compiler, FilterDocumentReader reader) {
        this.acceptance = Objects.requireNonNull(acceptance, "acceptance");
        this.parameterName = Objects.requireNonNull(policy, "policy").parameterName();
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    /**
     * @return the fields this stage lets clients filter on
     */
    public FilterAcceptance acceptance() {
        return acceptance;
    }

    /**
     * @return the query parameter this stage reads
     */
    public String parameterName() {
        return parameterName;
    }

    /**
     * Applies the filter carried by the request's query parameters.
     *
     * @param queryParameters decoded query parameters of the request
     * @param dataset         the dataset handle to narrow
     * @param <D>             dataset type
     * @return the narrowed dataset, or {@code dataset} itself when nothing is filtered
     * @throws FilterRejectedException if the filter cannot be decoded or compiled
     */
    public <D extends Dataset<D>> D apply(Map<String, String> queryParameters, D dataset) {
        return apply(queryParameters.get(parameterName), dataset);
    }

    /**
     * Applies a raw filter parameter.
     *
     * @param rawFilter the parameter value, possibly {@code null}
     * @param dataset   the dataset handle to narrow
     * @param <D>       dataset type
     * @return the narrowed dataset, or {@code dataset} itself when nothing is filtered
     * @throws FilterRejectedException if the filter cannot be decoded or compiled
     */
    public <D extends Dataset<D>> D apply(String rawFilter, D dataset) {
        Objects.requireNonNull(dataset, "dataset");
        if (rawFilter == null || rawFilter.isEmpty() || acceptance.isEmpty()) {
            return dataset;
        }

        Map<String, Object> document;
        try {
            document = reader.read(rawFilter);
        } catch (FilterDocumentException e) {
            logger.fine(() -> "Rejected " + parameterName + " parameter: " + e.getMessage());
            throw new FilterRejectedException(parameterName, FilterRejectedException.INVALID_VALUE, e);
        }

        Optional<Condition> condition;
        try {
            condition = compiler.compile(document, acceptance, dataset.filterContext());
        } catch (QueryException e) {
            logger.fine(() -> "Rejected " + parameterName + " parameter: " + e.getMessage());
            throw new FilterRejectedException(parameterName, e.getMessage(), e);
        }

        return condition.map(dataset::where).orElse(dataset);
    }
}
