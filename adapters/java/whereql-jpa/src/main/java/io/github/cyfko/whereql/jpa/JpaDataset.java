package io.github.cyfko.whereql.jpa;

import io.github.cyfko.whereql.core.api.Condition;
import io.github.cyfko.whereql.core.api.Dataset;
import io.github.cyfko.whereql.core.api.FilterContext;
import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Root;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Handle on the instances of a JPA entity, narrowed by filter conditions.
 * <p>
 * The handle is immutable: {@link #where(Condition)} returns a new handle whose condition
 * is the AND of the previous one and the given one. Nothing touches the database until
 * {@link #getResultList(EntityManager)} or {@link #count(EntityManager)} runs the query.
 * </p>
 *
 * <pre>{@code
 * JpaDataset<Sample> samples = JpaDataset.of(Sample.class, new JpaFilterContext<>(Map.of("int", "number")));
 * JpaDataset<Sample> filtered = stage.apply(queryParameters, samples);
 *
 * long total = filtered.count(em);
 * List<Sample> page = filtered.getResultList(em);
 * }</pre>
 *
 * @param <E> the entity type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class JpaDataset<E> implements Dataset<JpaDataset<E>> {

    private static final Logger logger = Logger.getLogger(JpaDataset.class.getName());

    private final Class<E> entityClass;
    private final JpaFilterContext<E> context;
    private final JpaCondition<E> condition;

    private JpaDataset(Class<E> entityClass, JpaFilterContext<E> context, JpaCondition<E> condition) {
        this.entityClass = Objects.requireNonNull(entityClass, "entityClass must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.condition = condition;
    }

    /**
     * @param entityClass the entity class
     * @param <E>         the entity type
     * @return an unrestricted handle whose filter fields are attribute names
     */
    public static <E> JpaDataset<E> of(Class<E> entityClass) {
        return new JpaDataset<>(entityClass, new JpaFilterContext<>(), null);
    }

    /**
     * @param entityClass the entity class
     * @param context     the context translating filter fields
     * @param <E>         the entity type
     * @return an unrestricted handle
     */
    public static <E> JpaDataset<E> of(Class<E> entityClass, JpaFilterContext<E> context) {
        return new JpaDataset<>(entityClass, context, null);
    }

    public Class<E> entityClass() {
        return entityClass;
    }

    /**
     * @return the accumulated condition, empty while unrestricted
     */
    public Optional<JpaCondition<E>> condition() {
        return Optional.ofNullable(condition);
    }

    @Override
    public FilterContext filterContext() {
        return context;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if {@code condition} is not a {@link JpaCondition}
     */
    @Override
    public JpaDataset<E> where(Condition condition) {
        if (!(condition instanceof JpaCondition<?>)) {
            throw new IllegalArgumentException("Expected a JPA condition, got: " + condition);
        }
        @SuppressWarnings("unchecked")
        JpaCondition<E> next = (JpaCondition<E>) condition;
        if (this.condition != null) {
            @SuppressWarnings("unchecked")
            JpaCondition<E> combined = (JpaCondition<E>) this.condition.and(next);
            next = combined;
        }
        return new JpaDataset<>(entityClass, context, next);
    }

    /**
     * Builds the selection query of this handle.
     *
     * @param cb the criteria builder
     * @return a query selecting the matching entities
     */
    public CriteriaQuery<E> toCriteriaQuery(CriteriaBuilder cb) {
        CriteriaQuery<E> query = cb.createQuery(entityClass);
        Root<E> root = query.from(entityClass);
        query.select(root);
        if (condition != null) {
            query.where(condition.resolver().resolve(root, query, cb));
            // joined collections repeat the root row
            query.distinct(!root.getJoins().isEmpty());
        }
        return query;
    }

    /**
     * Runs the selection query.
     *
     * @param em the entity manager
     * @return the matching entities
     */
    public List<E> getResultList(EntityManager em) {
        long startTime = System.nanoTime();

        List<E> results = em.createQuery(toCriteriaQuery(em.getCriteriaBuilder())).getResultList();

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.info(() -> String.format("%s query completed in %dms: %d results",
                entityClass.getSimpleName(), durationMs, results.size()));
        return results;
    }

    /**
     * Counts the matching entities.
     *
     * @param em the entity manager
     * @return the number of matching entities
     */
    public long count(EntityManager em) {
        long startTime = System.nanoTime();

        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<Long> countQuery = cb.createQuery(Long.class);
        Root<E> root = countQuery.from(entityClass);
        if (condition != null) {
            countQuery.where(condition.resolver().resolve(root, countQuery, cb));
        }
        countQuery.select(root.getJoins().isEmpty() ? cb.count(root) : cb.countDistinct(root));

        Long count = em.createQuery(countQuery).getSingleResult();

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.info(() -> String.format("%s count completed in %dms: %d matches",
                entityClass.getSimpleName(), durationMs, count));
        return count;
    }

    @Override
    public String toString() {
        return "JpaDataset[" + entityClass.getSimpleName() + (condition == null ? "" : ", filtered") + "]";
    }
}
