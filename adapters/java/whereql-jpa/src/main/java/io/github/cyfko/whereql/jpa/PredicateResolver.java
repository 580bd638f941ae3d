package io.github.cyfko.whereql.jpa;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

/**
 * Deferred construction of a Criteria {@link Predicate}.
 * <p>
 * A resolver captures everything needed to build a predicate except the query it belongs
 * to. The predicate is only built once a {@link Root} exists, that is when the query is
 * assembled:
 * </p>
 * <pre>{@code
 * PredicateResolver<Sample> positive = (root, query, cb) -> cb.greaterThan(root.get("number"), 0);
 *
 * CriteriaQuery<Sample> query = cb.createQuery(Sample.class);
 * Root<Sample> root = query.from(Sample.class);
 * query.where(positive.resolve(root, query, cb));
 * }</pre>
 *
 * @param <E> the entity type the predicate applies to
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface PredicateResolver<E> {

    /**
     * Builds the predicate.
     *
     * @param root  the query root
     * @param query the query being assembled
     * @param cb    the criteria builder
     * @return the predicate, never {@code null}
     */
    Predicate resolve(Root<E> root, CriteriaQuery<?> query, CriteriaBuilder cb);
}
