package io.github.cyfko.whereql.core.tree;

import java.util.Objects;

/**
 * Negation of a node, rendered {@code NOT(operand)}.
 *
 * @param operand the negated node
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record NotCondition(ConditionNode operand) implements ConditionNode {

    public NotCondition {
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public String render() {
        return "NOT(" + operand.render() + ")";
    }
}
