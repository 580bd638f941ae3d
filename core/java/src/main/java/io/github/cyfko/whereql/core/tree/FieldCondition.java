package io.github.cyfko.whereql.core.tree;

import io.github.cyfko.whereql.core.geo.GeoDistance;
import io.github.cyfko.whereql.core.geo.Geometry;
import io.github.cyfko.whereql.core.operator.OperatorKind;
import io.github.cyfko.whereql.core.operator.QueryOperator;
import io.github.cyfko.whereql.core.utils.JsonValues;

import java.time.temporal.Temporal;
import java.util.Objects;

/**
 * Leaf of the tree: one operator applied to one field.
 *
 * @param field    the filtered field
 * @param operator a generic operator, in canonical form
 * @param value    the validated operand
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FieldCondition(String field, QueryOperator operator, Object value) implements ConditionNode {

    public FieldCondition {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
        if (operator.kind() != OperatorKind.GENERIC) {
            throw new IllegalArgumentException(operator + " is not a field operator");
        }
        operator = operator.canonical();
    }

    @Override
    public String render() {
        return field + " " + symbol() + " " + renderOperand();
    }

    private String renderOperand() {
        if (value instanceof Geometry geometry) {
            return geometry.toWkt();
        }
        if (value instanceof GeoDistance distance) {
            return distance.geometry().toWkt() + " " + distance.distance();
        }
        return JsonValues.render(value instanceof Temporal ? value.toString() : value);
    }

    private String symbol() {
        return switch (operator) {
            case EQ -> "=";
            case NE -> "!=";
            case LT -> "<";
            case GT -> ">";
            case LTE -> "<=";
            case GTE -> ">=";
            case IN -> "IN";
            case NIN -> "NOT IN";
            default -> operator.token();
        };
    }
}
