package io.github.cyfko.whereql.core.tree;

import java.util.Objects;

/**
 * Disjunction of two nodes, rendered {@code (left OR right)}.
 *
 * @param left  first operand
 * @param right second operand
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record OrCondition(ConditionNode left, ConditionNode right) implements ConditionNode {

    public OrCondition {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public String render() {
        return "(" + left.render() + " OR " + right.render() + ")";
    }
}
