package io.github.cyfko.whereql.core.tree;

import io.github.cyfko.whereql.core.api.Condition;
import io.github.cyfko.whereql.core.api.FilterContext;
import io.github.cyfko.whereql.core.operator.QueryOperator;

/**
 * {@link FilterContext} building {@link FieldCondition} leaves.
 * <p>
 * Field names are kept as they are; resolving them is left to whoever consumes the tree.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TreeFilterContext implements FilterContext {

    @Override
    public Condition toCondition(String field, QueryOperator operator, Object value) {
        return new FieldCondition(field, operator, value);
    }
}
