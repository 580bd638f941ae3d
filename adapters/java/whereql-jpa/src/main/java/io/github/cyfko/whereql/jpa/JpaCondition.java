package io.github.cyfko.whereql.jpa;

import io.github.cyfko.whereql.core.api.Condition;

import java.util.Objects;

/**
 * JPA Criteria implementation of the {@link Condition} interface.
 * <p>
 * This record wraps a {@link PredicateResolver}: combining conditions combines their
 * resolvers, and no predicate is built until the query is assembled. It is the bridge
 * between compiled filter documents and the Criteria API.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * JpaCondition<Sample> named = new JpaCondition<>((root, query, cb) -> cb.equal(root.get("str"), "bar"));
 * JpaCondition<Sample> positive = new JpaCondition<>((root, query, cb) -> cb.greaterThan(root.get("number"), 0));
 *
 * // str = 'bar' AND NOT (number > 0)
 * Condition combined = named.and(positive.not());
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * {@code JpaCondition} is immutable. {@code and()}, {@code or()} and {@code not()} return
 * new instances, so conditions can be shared across threads and requests.
 * </p>
 *
 * @param <T>      the entity type this condition filters
 * @param resolver the underlying {@link PredicateResolver}
 * @author Frank KOSSI
 * @since 1.0.0
 * @see JpaFilterContext
 */
public record JpaCondition<T>(PredicateResolver<T> resolver) implements Condition {

    /**
     * @param resolver the resolver to wrap
     * @throws NullPointerException if {@code resolver} is null
     */
    public JpaCondition {
        Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if the other condition is not a JPA condition
     */
    @Override
    public Condition and(Condition other) {
        JpaCondition<T> otherCond = requireJpa(other);
        PredicateResolver<T> andResolver = (r, q, cb) -> cb.and(
                this.resolver.resolve(r, q, cb),
                otherCond.resolver.resolve(r, q, cb)
        );
        return new JpaCondition<>(andResolver);
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if the other condition is not a JPA condition
     */
    @Override
    public Condition or(Condition other) {
        JpaCondition<T> otherCond = requireJpa(other);
        PredicateResolver<T> orResolver = (r, q, cb) -> cb.or(
                this.resolver.resolve(r, q, cb),
                otherCond.resolver.resolve(r, q, cb)
        );
        return new JpaCondition<>(orResolver);
    }

    @Override
    public Condition not() {
        PredicateResolver<T> notResolver = (r, q, cb) -> cb.not(this.resolver.resolve(r, q, cb));
        return new JpaCondition<>(notResolver);
    }

    @SuppressWarnings("unchecked")
    private static <T> JpaCondition<T> requireJpa(Condition other) {
        if (!(other instanceof JpaCondition<?>)) {
            throw new IllegalArgumentException("Cannot combine with non-JPA condition");
        }
        return (JpaCondition<T>) other;
    }
}
