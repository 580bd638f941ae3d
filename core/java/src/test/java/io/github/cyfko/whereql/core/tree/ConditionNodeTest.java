package io.github.cyfko.whereql.core.tree;

import io.github.cyfko.whereql.core.api.Condition;
import io.github.cyfko.whereql.core.geo.GeoDistance;
import io.github.cyfko.whereql.core.geo.Geometry;
import io.github.cyfko.whereql.core.operator.QueryOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ConditionNodeTest {

    private final FieldCondition str = new FieldCondition("str", QueryOperator.EQ, "bar");
    private final FieldCondition num = new FieldCondition("int", QueryOperator.GT, 2);

    @Nested
    @DisplayName("Combination")
    class Combination {

        @Test
        void combinatorsBuildNodes() {
            assertEquals(new AndCondition(str, num), str.and(num));
            assertEquals(new OrCondition(str, num), str.or(num));
            assertEquals(new NotCondition(str), str.not());
        }

        @Test
        void foreignConditionsAreRefused() {
            Condition foreign = mock(Condition.class);
            assertThrows(IllegalArgumentException.class, () -> str.and(foreign));
            assertThrows(IllegalArgumentException.class, () -> str.or(foreign));
            assertThrows(NullPointerException.class, () -> str.and(null));
        }

        @Test
        void onlyFieldOperatorsMakeLeaves() {
            assertThrows(IllegalArgumentException.class, () -> new FieldCondition("a", QueryOperator.OR, List.of()));
            assertThrows(IllegalArgumentException.class, () -> new FieldCondition("a", QueryOperator.NOT, null));
            assertThrows(NullPointerException.class, () -> new FieldCondition(null, QueryOperator.EQ, 1));
        }

        @Test
        void aliasesAreStoredCanonically() {
            assertEquals(QueryOperator.LTE, new FieldCondition("a", QueryOperator.LE, 1).operator());
            assertEquals(new FieldCondition("a", QueryOperator.GTE, 1), new FieldCondition("a", QueryOperator.GE, 1));
        }
    }

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        void comparisons() {
            assertEquals("str = \"bar\"", str.render());
            assertEquals("int >= 2", new FieldCondition("int", QueryOperator.GE, 2).render());
            assertEquals("int NOT IN [1,2]", new FieldCondition("int", QueryOperator.NIN, List.of(1, 2)).render());
            assertEquals("str = null", new FieldCondition("str", QueryOperator.EQ, null).render());
            assertEquals("str $ilike \"b%\"", new FieldCondition("str", QueryOperator.ILIKE, "b%").render());
        }

        @Test
        void temporalsAndGeometries() {
            assertEquals("day < \"2024-01-01\"", new FieldCondition("day", QueryOperator.LT, LocalDate.of(2024, 1, 1)).render());
            assertEquals("area $geo.within POINT(1 2)",
                    new FieldCondition("area", QueryOperator.GEO_WITHIN, Geometry.point(1, 2)).render());
            assertEquals("area $geo.dwithin POINT(1 2) 5.0",
                    new FieldCondition("area", QueryOperator.GEO_DWITHIN, new GeoDistance(Geometry.point(1, 2), 5)).render());
        }

        @Test
        void composites() {
            ConditionNode tree = (ConditionNode) str.and(num.not()).or(str);
            assertEquals("((str = \"bar\" AND NOT(int > 2)) OR str = \"bar\")", tree.render());
        }
    }

    @Nested
    @DisplayName("Expression dataset")
    class Datasets {

        @Test
        void accumulatesRestrictions() {
            ExpressionDataset samples = ExpressionDataset.of("samples");
            ExpressionDataset once = samples.where(str);
            ExpressionDataset twice = once.where(num);

            assertTrue(samples.condition().isEmpty());
            assertEquals(str, once.condition().orElseThrow());
            assertEquals(new AndCondition(str, num), twice.condition().orElseThrow());
            assertEquals("samples", twice.name());
            assertEquals("ExpressionDataset[samples]", samples.toString());
        }

        @Test
        void contextBuildsLeaves() {
            Condition leaf = ExpressionDataset.of("samples").filterContext().toCondition("int", QueryOperator.IN, List.of(1));
            assertEquals(new FieldCondition("int", QueryOperator.IN, List.of(1)), leaf);
        }

        @Test
        void refusesForeignConditions() {
            assertThrows(IllegalArgumentException.class, () -> ExpressionDataset.of("samples").where(mock(Condition.class)));
        }
    }
}
