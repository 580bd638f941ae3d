package io.github.cyfko.whereql.core.compiler;

import io.github.cyfko.whereql.core.api.Condition;
import io.github.cyfko.whereql.core.api.FilterContext;
import io.github.cyfko.whereql.core.config.QueryPolicy;
import io.github.cyfko.whereql.core.exception.FilterComplexityException;
import io.github.cyfko.whereql.core.exception.QueryException;
import io.github.cyfko.whereql.core.operator.OperatorKind;
import io.github.cyfko.whereql.core.operator.OperatorTable;
import io.github.cyfko.whereql.core.operator.QueryOperator;
import io.github.cyfko.whereql.core.pipeline.FilterAcceptance;
import io.github.cyfko.whereql.core.utils.ValidationResult;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Recursive compiler turning filter documents into {@link Condition}s.
 * <p>
 * A filter document is a JSON object whose keys are either operator tokens
 * ({@code $and}, {@code $gte}, {@code $geo.within}, ...) or field names. Each level of
 * the document is compiled in three steps:
 * </p>
 * <ol>
 *   <li><strong>Operators:</strong> every operator key is built according to its
 *       {@link OperatorKind}, and the results are AND-combined</li>
 *   <li><strong>Fields:</strong> every key of the allowed-field set is compiled as a
 *       nested level whose field context is that key; a non-object value {@code v} is
 *       shorthand for {@code {"$eq": v}}. The results are AND-combined</li>
 *   <li><strong>Combination:</strong> the operator part is AND-ed with the field part</li>
 * </ol>
 * <p>
 * Keys that are neither operators nor allowed fields are ignored. A level that yields
 * nothing (empty object, only unknown keys) produces no condition, and "no condition"
 * is the identity of every AND.
 * </p>
 *
 * <h2>Operator kinds</h2>
 * <ul>
 *   <li><strong>GENERIC</strong>: validated, then handed to
 *       {@link FilterContext#toCondition(String, QueryOperator, Object)} with the
 *       enclosing field. Outside of a field, a generic operator is an error</li>
 *   <li><strong>GLUE</strong>: each sub-document is compiled with the field context
 *       reset. {@code $and} skips empty sub-documents; an empty sub-document in
 *       {@code $or} leaves the disjunction unconstrained, so {@code $or} yields nothing</li>
 *   <li><strong>NEGATION</strong>: the sub-document is compiled in the current field
 *       context and negated; negating nothing yields nothing</li>
 * </ul>
 *
 * <h2>Usage example</h2>
 * <pre>{@code
 * ConditionCompiler compiler = new ConditionCompiler();
 * Map<String, Object> document = Map.of(
 *     "int", Map.of("$gte", 0, "$lt", 2),
 *     "$not", Map.of("str", "bar"));
 *
 * Optional<Condition> condition = compiler.compile(document, Set.of("int", "str"), context);
 * // NOT(str = 'bar') AND (int >= 0 AND int < 2)
 * }</pre>
 *
 * <h2>Errors</h2>
 * <p>
 * Operand problems raise {@link QueryException} naming the operator and the operand as
 * sent; it propagates unmodified. Documents nesting deeper than
 * {@link QueryPolicy#maxDepth()} raise {@link FilterComplexityException}.
 * </p>
 *
 * <p>The compiler holds no mutable state and is safe for concurrent use.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ConditionCompiler {

    private static final Logger logger = Logger.getLogger(ConditionCompiler.class.getName());

    private final OperatorTable operators;
    private final int maxDepth;

    /**
     * Compiler over the full operator vocabulary with {@link QueryPolicy#defaults()}.
     */
    public ConditionCompiler() {
        this(OperatorTable.standard(), QueryPolicy.defaults());
    }

    /**
     * @param operators the operators recognized in documents
     * @param policy    limits applied while compiling
     * @throws NullPointerException if an argument is null
     */
    public ConditionCompiler(OperatorTable operators, QueryPolicy policy) {
        this.operators = Objects.requireNonNull(operators, "operators");
        this.maxDepth = Objects.requireNonNull(policy, "policy").maxDepth();
    }

    /**
     * Compiles a document against the fields currently accepted by {@code acceptance}.
     * The accepted set is read once, so a concurrent replacement does not affect this call.
     *
     * @see #compile(Map, Set, FilterContext)
     */
    public Optional<Condition> compile(Map<String, ?> document, FilterAcceptance acceptance, FilterContext context) {
        return compile(document, Objects.requireNonNull(acceptance, "acceptance").snapshot(), context);
    }

    /**
     * Compiles a filter document.
     *
     * @param document      the decoded JSON object
     * @param allowedFields field names the document may reference
     * @param context       builds the field-level conditions
     * @return the combined condition, or empty if the document constrains nothing
     * @throws QueryException            if an operator receives an invalid operand
     * @throws FilterComplexityException if the document nests too deeply
     * @throws NullPointerException      if an argument is null
     */
    public Optional<Condition> compile(Map<String, ?> document, Set<String> allowedFields, FilterContext context) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(allowedFields, "allowedFields");
        Objects.requireNonNull(context, "context");

        Condition condition = compileLevel(document, new Scope(allowedFields, context, null, 1));
        logger.fine(() -> "Compiled filter " + document.keySet() + " into " + condition);
        return Optional.ofNullable(condition);
    }

    private Condition compileLevel(Map<?, ?> document, Scope scope) {
        Condition operatorPart = null;
        for (Map.Entry<?, ?> entry : document.entrySet()) {
            Optional<QueryOperator> operator = operators.find(String.valueOf(entry.getKey()));
            if (operator.isPresent()) {
                operatorPart = and(operatorPart, build(operator.get(), entry.getValue(), scope));
            }
        }

        Condition fieldPart = null;
        for (Map.Entry<?, ?> entry : document.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (scope.allowedFields().contains(key) && !operators.contains(key)) {
                fieldPart = and(fieldPart, compileField(key, entry.getValue(), scope));
            }
        }

        return and(operatorPart, fieldPart);
    }

    private Condition compileField(String field, Object value, Scope scope) {
        Map<?, ?> document = value instanceof Map<?, ?> map
                ? map
                : Collections.singletonMap(QueryOperator.EQ.token(), value);
        return compileLevel(document, descend(scope, field, field));
    }

    private Condition build(QueryOperator operator, Object value, Scope scope) {
        return switch (operator.kind()) {
            case GENERIC -> buildGeneric(operator, value, scope);
            case GLUE -> buildGlue(operator, value, scope);
            case NEGATION -> buildNegation(operator, value, scope);
        };
    }

    private Condition buildGeneric(QueryOperator operator, Object value, Scope scope) {
        if (scope.field() == null) {
            logger.fine(() -> operator + " used outside of a field");
            throw new QueryException(operator.token(), value);
        }
        Object operand = validate(operator, value);
        return scope.context().toCondition(scope.field(), operator, operand);
    }

    private Condition buildGlue(QueryOperator operator, Object value, Scope scope) {
        List<?> documents = (List<?>) validate(operator, value);
        Scope inner = descend(scope, operator.token(), null);

        Condition combined = null;
        boolean unconstrained = false;
        for (Object document : documents) {
            Condition part = compileLevel((Map<?, ?>) document, inner);
            if (operator == QueryOperator.OR) {
                if (part == null) {
                    unconstrained = true;
                } else {
                    combined = combined == null ? part : combined.or(part);
                }
            } else {
                combined = and(combined, part);
            }
        }
        return unconstrained ? null : combined;
    }

    private Condition buildNegation(QueryOperator operator, Object value, Scope scope) {
        Map<?, ?> document = (Map<?, ?>) validate(operator, value);
        Condition inner = compileLevel(document, descend(scope, operator.token(), scope.field()));
        return inner == null ? null : inner.not();
    }

    private static Object validate(QueryOperator operator, Object value) {
        ValidationResult<Object> result = operator.validate(value);
        if (!result.isValid()) {
            logger.fine(() -> operator + " refused its operand: " + result.getErrorMessage());
            throw new QueryException(operator.token(), value);
        }
        return result.getValue();
    }

    private Scope descend(Scope scope, String key, String field) {
        int depth = scope.depth() + 1;
        if (depth > maxDepth) {
            throw new FilterComplexityException(key, maxDepth);
        }
        return new Scope(scope.allowedFields(), scope.context(), field, depth);
    }

    private static Condition and(Condition left, Condition right) {
        if (left == null) return right;
        if (right == null) return left;
        return left.and(right);
    }

    /**
     * What a level of the document is compiled against.
     *
     * @param field the enclosing field, or {@code null} at top level and inside glue operators
     * @param depth 1 for the top-level document
     */
    private record Scope(Set<String> allowedFields, FilterContext context, String field, int depth) {
    }
}
