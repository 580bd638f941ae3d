package io.github.cyfko.whereql.core.api;

/**
 * Handle on a filterable set of records, passed down the request pipeline.
 * <p>
 * A dataset knows the {@link FilterContext} able to build conditions over its records
 * and returns a narrowed copy of itself through {@link #where(Condition)}. Handles are
 * immutable: {@code where} never modifies the receiver.
 * </p>
 *
 * @param <D> the concrete dataset type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface Dataset<D extends Dataset<D>> {

    /**
     * @return the context building conditions for this dataset's records
     */
    FilterContext filterContext();

    /**
     * Returns a dataset restricted to the records matching {@code condition}, in
     * addition to any restriction this dataset already carries.
     *
     * @param condition the condition to AND onto the current restriction
     * @return the narrowed dataset
     * @throws IllegalArgumentException if the condition was built by another backend
     */
    D where(Condition condition);
}
