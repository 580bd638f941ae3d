package io.github.cyfko.whereql.core.operator;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup from wire tokens to {@link QueryOperator}s.
 * <p>
 * The table is built once and only read afterwards, so a single instance is shared by
 * every compilation. {@link #standard()} holds the full vocabulary;
 * {@link #of(Collection)} builds a narrower table for endpoints that only expose part
 * of it: keys outside the table are then ignored like unknown fields.
 * </p>
 *
 * <pre>{@code
 * OperatorTable table = OperatorTable.standard();
 * table.find("$gte");        // Optional[GTE]
 * table.find("$unknown");    // Optional.empty()
 *
 * OperatorTable noGeo = OperatorTable.of(EnumSet.range(QueryOperator.AND, QueryOperator.IREGEX));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class OperatorTable {

    private static final OperatorTable STANDARD = new OperatorTable(EnumSet.allOf(QueryOperator.class));

    private final Map<String, QueryOperator> byToken;

    private OperatorTable(Set<QueryOperator> operators) {
        Map<String, QueryOperator> map = new LinkedHashMap<>();
        for (QueryOperator operator : operators) {
            map.put(operator.token(), operator);
        }
        this.byToken = Map.copyOf(map);
    }

    /**
     * @return the table holding every operator
     */
    public static OperatorTable standard() {
        return STANDARD;
    }

    /**
     * Builds a table restricted to the given operators.
     *
     * @param operators operators to expose
     * @return the restricted table
     * @throws NullPointerException if {@code operators} is null
     */
    public static OperatorTable of(Collection<QueryOperator> operators) {
        Objects.requireNonNull(operators, "operators");
        return new OperatorTable(operators.isEmpty()
                ? EnumSet.noneOf(QueryOperator.class)
                : EnumSet.copyOf(operators));
    }

    /**
     * @param token a key of a filter document
     * @return the operator for that token, or empty
     */
    public Optional<QueryOperator> find(String token) {
        return Optional.ofNullable(byToken.get(token));
    }

    /**
     * @param token a key of a filter document
     * @return {@code true} if the key is an operator of this table
     */
    public boolean contains(String token) {
        return byToken.containsKey(token);
    }

    /**
     * @return the tokens of this table
     */
    public Set<String> tokens() {
        return byToken.keySet();
    }
}
