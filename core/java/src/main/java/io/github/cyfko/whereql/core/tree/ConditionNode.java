package io.github.cyfko.whereql.core.tree;

import io.github.cyfko.whereql.core.api.Condition;

/**
 * Node of the backend-neutral condition tree.
 * <p>
 * Nodes are immutable records with structural equality: two filter documents meaning
 * the same thing compile to equal trees. This makes the tree the natural target for
 * inspecting, logging or translating a compiled filter without a database at hand.
 * </p>
 *
 * <pre>{@code
 * ConditionNode tree = (ConditionNode) compiler.compile(document, fields, new TreeFilterContext()).orElseThrow();
 * tree.render();   // "(int >= 0 AND int < 2)"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ConditionNode extends Condition {

    @Override
    default Condition and(Condition other) {
        return new AndCondition(this, requireNode(other));
    }

    @Override
    default Condition or(Condition other) {
        return new OrCondition(this, requireNode(other));
    }

    @Override
    default Condition not() {
        return new NotCondition(this);
    }

    /**
     * @return an infix rendering of the tree, e.g. {@code NOT(str = "bar")}
     */
    String render();

    private static ConditionNode requireNode(Condition other) {
        if (other == null) {
            throw new NullPointerException("Other condition cannot be null");
        }
        if (!(other instanceof ConditionNode node)) {
            throw new IllegalArgumentException("Cannot combine with non-tree condition: " + other.getClass().getName());
        }
        return node;
    }
}
