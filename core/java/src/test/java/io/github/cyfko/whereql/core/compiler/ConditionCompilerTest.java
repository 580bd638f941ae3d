package io.github.cyfko.whereql.core.compiler;

import io.github.cyfko.whereql.core.api.Condition;
import io.github.cyfko.whereql.core.api.FilterContext;
import io.github.cyfko.whereql.core.config.QueryPolicy;
import io.github.cyfko.whereql.core.exception.FilterComplexityException;
import io.github.cyfko.whereql.core.exception.QueryException;
import io.github.cyfko.whereql.core.geo.Geometry;
import io.github.cyfko.whereql.core.operator.OperatorTable;
import io.github.cyfko.whereql.core.operator.QueryOperator;
import io.github.cyfko.whereql.core.pipeline.FilterAcceptance;
import io.github.cyfko.whereql.core.pipeline.FilterDocumentReader;
import io.github.cyfko.whereql.core.tree.AndCondition;
import io.github.cyfko.whereql.core.tree.ConditionNode;
import io.github.cyfko.whereql.core.tree.FieldCondition;
import io.github.cyfko.whereql.core.tree.NotCondition;
import io.github.cyfko.whereql.core.tree.OrCondition;
import io.github.cyfko.whereql.core.tree.TreeFilterContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ConditionCompilerTest {

    private static final Set<String> SAMPLE_FIELDS = Set.of("str", "int", "float", "datetime");
    private static final FilterDocumentReader READER = new FilterDocumentReader(8192);

    private ConditionCompiler compiler;
    private TreeFilterContext context;

    @BeforeEach
    void setUp() {
        compiler = new ConditionCompiler();
        context = new TreeFilterContext();
    }

    /**
     * Parses a JSON document written with single quotes.
     */
    private static Map<String, Object> doc(String json) {
        return READER.read(json.replace('\'', '"'));
    }

    private Condition compile(String json, Set<String> fields) {
        return compiler.compile(doc(json), fields, context).orElse(null);
    }

    private Condition compile(String json) {
        return compile(json, SAMPLE_FIELDS);
    }

    private static FieldCondition field(String field, QueryOperator operator, Object value) {
        return new FieldCondition(field, operator, value);
    }

    @Nested
    @DisplayName("Field keys")
    class FieldKeys {

        @Test
        @DisplayName("Scalar value is shorthand for $eq")
        void scalarIsEqualityShorthand() {
            assertEquals(compile("{'str': 'bar'}"), compile("{'str': {'$eq': 'bar'}}"));
            assertEquals(field("str", QueryOperator.EQ, "bar"), compile("{'str': 'bar'}"));
            assertEquals(field("int", QueryOperator.EQ, 2), compile("{'int': 2}"));
            assertEquals(field("float", QueryOperator.EQ, 2.3), compile("{'float': 2.3}"));
        }

        @Test
        @DisplayName("Null and list values are shorthand for $eq too")
        void nullAndListShorthand() {
            assertEquals(field("str", QueryOperator.EQ, null), compile("{'str': null}"));
            assertEquals(field("int", QueryOperator.EQ, List.of(1, 2)), compile("{'int': [1, 2]}"));
        }

        @Test
        @DisplayName("Several operators on one field are AND-combined")
        void rangeOnOneField() {
            Condition expected = field("int", QueryOperator.GTE, 0).and(field("int", QueryOperator.LT, 2));
            assertEquals(expected, compile("{'int': {'$gte': 0, '$lt': 2}}"));
        }

        @Test
        @DisplayName("Several fields are AND-combined in document order")
        void severalFields() {
            Condition expected = field("str", QueryOperator.EQ, "bar").and(field("int", QueryOperator.EQ, 1));
            assertEquals(expected, compile("{'str': 'bar', 'int': 1}"));
        }

        @Test
        @DisplayName("Fields outside the allowed set are dropped")
        void unknownFieldsDropped() {
            assertEquals(compile("{'str': 'bar'}", Set.of("str")),
                    compile("{'str': 'bar', 'secret': 'x'}", Set.of("str")));
            assertNull(compile("{'secret': {'$in': 'not-a-list'}}", Set.of("str")));
        }

        @Test
        @DisplayName("Unknown operator tokens are dropped")
        void unknownOperatorsDropped() {
            assertEquals(field("int", QueryOperator.GT, 1), compile("{'int': {'$gt': 1, '$near': 3}}"));
            assertNull(compile("{'$whatever': 1}"));
        }

        @Test
        @DisplayName("Date-time strings are converted for ordering operators")
        void datetimeRange() {
            Condition expected = field("datetime", QueryOperator.GTE, LocalDateTime.of(2024, 1, 1, 0, 0))
                    .and(field("datetime", QueryOperator.LT, LocalDateTime.of(2024, 1, 2, 0, 0)));
            assertEquals(expected,
                    compile("{'datetime': {'$gte': '2024-01-01T00:00:00', '$lt': '2024-01-02T00:00:00'}}"));
        }

        @Test
        @DisplayName("$le and $lte build the same condition")
        void aliasesAreFolded() {
            assertEquals(compile("{'int': {'$lte': 3}}"), compile("{'int': {'$le': 3}}"));
            assertEquals(compile("{'int': {'$gte': 3}}"), compile("{'int': {'$ge': 3}}"));
        }

        @Test
        @DisplayName("Empty document compiles to nothing")
        void emptyDocument() {
            assertNull(compile("{}"));
            assertNull(compile("{'int': {}}"));
        }
    }

    @Nested
    @DisplayName("Glue operators")
    class Glue {

        @Test
        @DisplayName("$and equals the AND of its parts")
        void andOfParts() {
            Condition a = compile("{'str': 'bar'}");
            Condition b = compile("{'int': {'$gt': 2}}");
            assertEquals(a.and(b), compile("{'$and': [{'str': 'bar'}, {'int': {'$gt': 2}}]}"));
        }

        @Test
        @DisplayName("$or equals the OR of its parts")
        void orOfParts() {
            Condition a = compile("{'float': 3.2}");
            Condition b = compile("{'int': {'$gt': 2}}");
            assertEquals(a.or(b), compile("{'$or': [{'float': 3.2}, {'int': {'$gt': 2}}]}"));
        }

        @Test
        @DisplayName("$and skips empty sub-documents")
        void andSkipsEmpty() {
            assertEquals(compile("{'str': 'bar'}"), compile("{'$and': [{}, {'str': 'bar'}, {'unknown': 1}]}"));
        }

        @Test
        @DisplayName("$or with an empty sub-document constrains nothing")
        void orAbsorbedByEmpty() {
            assertNull(compile("{'$or': [{'str': 'bar'}, {}]}"));
            assertEquals(compile("{'int': 1}"), compile("{'$or': [{'str': 'bar'}, {}], 'int': 1}"));
        }

        @Test
        @DisplayName("Empty glue lists compile to nothing")
        void emptyLists() {
            assertNull(compile("{'$and': []}"));
            assertNull(compile("{'$or': []}"));
        }

        @Test
        @DisplayName("Glue operands must be lists of documents")
        void glueShape() {
            QueryException notList = assertThrows(QueryException.class, () -> compile("{'$or': {'str': 'bar'}}"));
            assertEquals("$or", notList.getOperator());

            QueryException notDocs = assertThrows(QueryException.class, () -> compile("{'$and': [{'str': 'bar'}, 3]}"));
            assertEquals("$and", notDocs.getOperator());
            assertEquals(List.of(Map.of("str", "bar"), 3), notDocs.getValue());
        }

        @Test
        @DisplayName("Glue resets the field context")
        void glueResetsField() {
            QueryException e = assertThrows(QueryException.class,
                    () -> compile("{'int': {'$or': [{'$gt': 5}, {'$lt': 0}]}}"));
            assertEquals("$gt", e.getOperator());
        }

        @Test
        @DisplayName("Errors in later $or branches are still reported")
        void orValidatesEveryBranch() {
            assertThrows(QueryException.class, () -> compile("{'$or': [{}, {'int': {'$in': 4}}]}"));
        }
    }

    @Nested
    @DisplayName("Negation")
    class Negation {

        @Test
        @DisplayName("$not negates its sub-document")
        void notOfPart() {
            assertEquals(compile("{'int': {'$in': [4, 5]}}").not(), compile("{'$not': {'int': {'$in': [4, 5]}}}"));
        }

        @Test
        @DisplayName("$not keeps the enclosing field")
        void notInsideField() {
            assertEquals(new NotCondition(field("int", QueryOperator.GT, 3)), compile("{'int': {'$not': {'$gt': 3}}}"));
        }

        @Test
        @DisplayName("Negating an empty document yields nothing")
        void notOfNothing() {
            assertNull(compile("{'$not': {}}"));
            assertNull(compile("{'$not': {'unknown': 1}}"));
        }

        @Test
        @DisplayName("$not operand must be a document")
        void notShape() {
            QueryException e = assertThrows(QueryException.class, () -> compile("{'$not': [1]}"));
            assertEquals("$not", e.getOperator());
            assertEquals("Invalid $not condition: [1]", e.getMessage());
        }
    }

    @Nested
    @DisplayName("Operand validation")
    class Validation {

        @Test
        @DisplayName("$in requires a list")
        void inRequiresList() {
            QueryException e = assertThrows(QueryException.class, () -> compile("{'int': {'$in': 'not-a-list'}}"));
            assertEquals("$in", e.getOperator());
            assertEquals("not-a-list", e.getValue());
            assertEquals("Invalid $in condition: \"not-a-list\"", e.getMessage());
        }

        @Test
        @DisplayName("$exists requires a boolean")
        void existsRequiresBoolean() {
            QueryException e = assertThrows(QueryException.class, () -> compile("{'str': {'$exists': 'yes'}}"));
            assertEquals("$exists", e.getOperator());
            assertEquals(field("str", QueryOperator.EXISTS, true), compile("{'str': {'$exists': true}}"));
        }

        @Test
        @DisplayName("Ordering operators refuse booleans and free text")
        void orderingShape() {
            assertThrows(QueryException.class, () -> compile("{'int': {'$gt': true}}"));
            assertThrows(QueryException.class, () -> compile("{'int': {'$lt': 'tomorrow'}}"));
        }

        @Test
        @DisplayName("Field operators at top level are errors")
        void genericWithoutField() {
            QueryException e = assertThrows(QueryException.class, () -> compile("{'$eq': 3}"));
            assertEquals("$eq", e.getOperator());
        }

        @Test
        @DisplayName("Nested errors propagate unmodified")
        void nestedErrorsPropagate() {
            QueryException e = assertThrows(QueryException.class,
                    () -> compile("{'$or': [{'$not': {'int': {'$nin': 7}}}]}"));
            assertEquals("$nin", e.getOperator());
            assertEquals(7, e.getValue());
        }

        @Test
        @DisplayName("Context failures are not translated into query errors")
        void contextFailuresPropagate() {
            FilterContext failing = mock(FilterContext.class);
            when(failing.toCondition(anyString(), any(), any())).thenThrow(new IllegalArgumentException("no such column"));

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> compiler.compile(doc("{'int': 1}"), SAMPLE_FIELDS, failing));
            assertEquals("no such column", e.getMessage());
        }
    }

    @Nested
    @DisplayName("Geometry")
    class Geometries {

        @Test
        @DisplayName("Decoded point equals a point built directly")
        void pointRoundTrip() {
            Condition compiled = compile("{'area': {'$geo.equals': {'type': 'point', 'coordinates': [1, 2]}}}", Set.of("area"));
            assertEquals(field("area", QueryOperator.GEO_EQUALS, Geometry.point(1, 2)), compiled);
        }

        @Test
        @DisplayName("Unknown geometry kinds are refused")
        void unknownKind() {
            QueryException e = assertThrows(QueryException.class,
                    () -> compile("{'area': {'$geo.within': {'type': 'circle', 'coordinates': [1, 2]}}}", Set.of("area")));
            assertEquals("$geo.within", e.getOperator());
        }
    }

    @Nested
    @DisplayName("Combination")
    class Combination {

        @Test
        @DisplayName("Operators and fields at the same level are AND-combined")
        void combinedScenario() {
            Condition compiled = compile("{'str': 'bar', 'int': {'$gt': 2}, '$not': {'int': {'$in': [4, 5]}},"
                    + " '$or': [{'float': 3.2}, {'datetime': {'$gte': '2024-01-01T00:00:00', '$lt': '2024-01-02T00:00:00'}}]}");

            ConditionNode notIn = new NotCondition(field("int", QueryOperator.IN, List.of(4, 5)));
            ConditionNode either = new OrCondition(
                    field("float", QueryOperator.EQ, 3.2),
                    new AndCondition(
                            field("datetime", QueryOperator.GTE, LocalDateTime.of(2024, 1, 1, 0, 0)),
                            field("datetime", QueryOperator.LT, LocalDateTime.of(2024, 1, 2, 0, 0))));
            ConditionNode fields = new AndCondition(field("str", QueryOperator.EQ, "bar"), field("int", QueryOperator.GT, 2));

            assertEquals(new AndCondition(new AndCondition(notIn, either), fields), compiled);
        }

        @Test
        @DisplayName("Only the $or sub-documents are OR-ed")
        void orOnly() {
            Condition compiled = compile("{'$or': [{'str': 'bar'}, {'int': {'$gt': 0}}]}");
            assertEquals(new OrCondition(field("str", QueryOperator.EQ, "bar"), field("int", QueryOperator.GT, 0)), compiled);
        }

        @Test
        @DisplayName("Combination goes through the Condition interface")
        void combinesThroughConditions() {
            FilterContext mocked = mock(FilterContext.class);
            Condition strCondition = mock(Condition.class);
            Condition intCondition = mock(Condition.class);
            Condition combined = mock(Condition.class);
            when(mocked.toCondition(eq("str"), eq(QueryOperator.EQ), eq("bar"))).thenReturn(strCondition);
            when(mocked.toCondition(eq("int"), eq(QueryOperator.GT), eq(2))).thenReturn(intCondition);
            when(strCondition.or(intCondition)).thenReturn(combined);

            Optional<Condition> result = compiler.compile(
                    doc("{'$or': [{'str': 'bar'}, {'int': {'$gt': 2}}]}"), SAMPLE_FIELDS, mocked);

            assertSame(combined, result.orElseThrow());
            verify(strCondition).or(intCondition);
            verifyNoMoreInteractions(intCondition);
        }
    }

    @Nested
    @DisplayName("Limits and configuration")
    class Limits {

        @Test
        @DisplayName("Nesting beyond the maximum depth is refused")
        void depthLimit() {
            ConditionCompiler shallow = new ConditionCompiler(OperatorTable.standard(), QueryPolicy.builder().maxDepth(3).build());
            Map<String, Object> ok = doc("{'$not': {'int': 1}}");
            Map<String, Object> tooDeep = doc("{'$not': {'$not': {'$not': {'int': 1}}}}");

            assertTrue(shallow.compile(ok, SAMPLE_FIELDS, context).isPresent());
            FilterComplexityException e = assertThrows(FilterComplexityException.class,
                    () -> shallow.compile(tooDeep, SAMPLE_FIELDS, context));
            assertEquals(3, e.getMaxDepth());
            assertEquals("Filter nesting exceeds maximum depth of 3", e.getMessage());
        }

        @Test
        @DisplayName("Very deep documents fail cleanly with the default policy")
        void deepDocumentDoesNotOverflow() {
            StringBuilder json = new StringBuilder();
            for (int i = 0; i < 500; i++) json.append("{\"$not\":");
            json.append("{}");
            for (int i = 0; i < 500; i++) json.append('}');
            Map<String, Object> document = new FilterDocumentReader(100_000).read(json.toString());

            assertThrows(FilterComplexityException.class, () -> compiler.compile(document, SAMPLE_FIELDS, context));
        }

        @Test
        @DisplayName("Operators outside a restricted table are ignored")
        void restrictedTable() {
            ConditionCompiler noGeo = new ConditionCompiler(
                    OperatorTable.of(EnumSet.of(QueryOperator.EQ, QueryOperator.AND)), QueryPolicy.defaults());
            Optional<Condition> result = noGeo.compile(
                    doc("{'int': {'$gt': 2, '$eq': 1}}"), SAMPLE_FIELDS, context);
            assertEquals(Optional.of(field("int", QueryOperator.EQ, 1)), result);
        }

        @Test
        @DisplayName("Accepted fields are read from the acceptance")
        void compileWithAcceptance() {
            FilterAcceptance acceptance = FilterAcceptance.of("str");
            assertTrue(compiler.compile(doc("{'str': 'a', 'int': 1}"), acceptance, context).isPresent());
            acceptance.replace(Set.of());
            assertTrue(compiler.compile(doc("{'str': 'a', 'int': 1}"), acceptance, context).isEmpty());
        }
    }
}
