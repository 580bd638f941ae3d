package io.github.cyfko.whereql.core.tree;

import io.github.cyfko.whereql.core.api.Condition;
import io.github.cyfko.whereql.core.api.Dataset;
import io.github.cyfko.whereql.core.api.FilterContext;

import java.util.Objects;
import java.util.Optional;

/**
 * Dataset handle recording its restriction as a condition tree.
 * <p>
 * Useful wherever the filtered records live outside of this library: the handle carries
 * the compiled tree to the code that knows how to query them.
 * </p>
 *
 * <pre>{@code
 * ExpressionDataset samples = ExpressionDataset.of("samples");
 * ExpressionDataset filtered = stage.apply(request.queryParameters(), samples);
 * filtered.condition().map(ConditionNode::render);   // Optional["(int > 2)"]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ExpressionDataset implements Dataset<ExpressionDataset> {

    private static final FilterContext CONTEXT = new TreeFilterContext();

    private final String name;
    private final ConditionNode condition;

    private ExpressionDataset(String name, ConditionNode condition) {
        this.name = Objects.requireNonNull(name, "name");
        this.condition = condition;
    }

    /**
     * @param name name of the underlying record set, e.g. a table
     * @return an unrestricted dataset
     */
    public static ExpressionDataset of(String name) {
        return new ExpressionDataset(name, null);
    }

    public String name() {
        return name;
    }

    /**
     * @return the accumulated restriction, empty while unrestricted
     */
    public Optional<ConditionNode> condition() {
        return Optional.ofNullable(condition);
    }

    @Override
    public FilterContext filterContext() {
        return CONTEXT;
    }

    @Override
    public ExpressionDataset where(Condition condition) {
        if (!(condition instanceof ConditionNode node)) {
            throw new IllegalArgumentException("Expected a tree condition, got: " + condition);
        }
        return new ExpressionDataset(name, this.condition == null ? node : (ConditionNode) this.condition.and(node));
    }

    @Override
    public String toString() {
        return "ExpressionDataset[" + name + condition().map(c -> " WHERE " + c.render()).orElse("") + "]";
    }
}
