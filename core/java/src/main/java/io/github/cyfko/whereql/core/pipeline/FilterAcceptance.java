package io.github.cyfko.whereql.core.pipeline;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * The set of fields an endpoint lets clients filter on.
 * <p>
 * The set is held as an immutable snapshot. {@link #replace(Collection)} swaps it
 * wholesale, so a reader always sees either the previous or the new set, never a mix;
 * reads take no lock.
 * </p>
 *
 * <pre>{@code
 * FilterAcceptance acceptance = FilterAcceptance.of("name", "age");
 * acceptance.accepts("age");              // true
 * acceptance.replace(List.of("name"));   // an admin narrowed the filterable fields
 * acceptance.accepts("age");              // false
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FilterAcceptance {

    private static final Logger logger = Logger.getLogger(FilterAcceptance.class.getName());

    private volatile Set<String> accepted;

    /**
     * @param fields the initially filterable fields
     * @throws NullPointerException if {@code fields} or one of its elements is null
     */
    public FilterAcceptance(Collection<String> fields) {
        this.accepted = Set.copyOf(fields);
    }

    public static FilterAcceptance of(String... fields) {
        return new FilterAcceptance(Arrays.asList(fields));
    }

    /**
     * Replaces the filterable fields.
     *
     * @param fields the new set of filterable fields
     * @throws NullPointerException if {@code fields} or one of its elements is null
     */
    public void replace(Collection<String> fields) {
        Set<String> next = Set.copyOf(Objects.requireNonNull(fields, "fields"));
        this.accepted = next;
        logger.fine(() -> "Filterable fields replaced: " + next);
    }

    /**
     * @param field a key of a filter document
     * @return {@code true} if clients may filter on that field
     */
    public boolean accepts(String field) {
        return accepted.contains(field);
    }

    /**
     * @return {@code true} when no field is filterable, which disables filtering
     */
    public boolean isEmpty() {
        return accepted.isEmpty();
    }

    /**
     * @return the current set; later replacements do not affect it
     */
    public Set<String> snapshot() {
        return accepted;
    }
}
