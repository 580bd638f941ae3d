package io.github.cyfko.whereql.core.tree;

import java.util.Objects;

/**
 * Conjunction of two nodes, rendered {@code (left AND right)}.
 *
 * @param left  first operand
 * @param right second operand
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record AndCondition(ConditionNode left, ConditionNode right) implements ConditionNode {

    public AndCondition {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public String render() {
        return "(" + left.render() + " AND " + right.render() + ")";
    }
}
