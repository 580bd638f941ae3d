package io.github.cyfko.whereql.jpa.utils;

import jakarta.persistence.criteria.From;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.ManagedType;
import jakarta.persistence.metamodel.PluralAttribute;
import jakarta.persistence.metamodel.SingularAttribute;
import jakarta.persistence.metamodel.Type;

/**
 * Resolves dotted attribute paths against a Criteria {@link From}.
 * <p>
 * A path such as {@code "owner.address.city"} is split into segments. Every segment but the
 * last is navigated through the JPA metamodel:
 * </p>
 * <ul>
 *   <li>associations (to-one or collections) are LEFT-joined, reusing a join the query
 *       already holds for the same attribute</li>
 *   <li>embeddables are navigated with {@link Path#get(String)}, without a join</li>
 * </ul>
 * <p>
 * The last segment is always read with {@link Path#get(String)}.
 * </p>
 *
 * <h2>Usage example:</h2>
 * <pre>{@code
 * Root<Sample> root = query.from(Sample.class);
 * Path<?> city = AttributePaths.resolve(root, "owner.city");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AttributePaths {

    private AttributePaths() {
        throw new UnsupportedOperationException("AttributePaths is a utility class and cannot be instantiated");
    }

    /**
     * Resolves {@code path} from {@code from}.
     *
     * @param from the root or join to start from
     * @param path attribute names separated by dots
     * @return the resolved path
     * @throws IllegalArgumentException if the path is blank or a segment is not an attribute
     */
    public static Path<?> resolve(From<?, ?> from, String path) {
        if (from == null) {
            throw new IllegalArgumentException("From cannot be null");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Path cannot be null or blank");
        }

        String[] segments = path.split("\\.");
        From<?, ?> currentFrom = from;
        Path<?> current = from;
        ManagedType<?> currentType = managedType(from.getModel(), path);

        for (int i = 0; i < segments.length - 1; i++) {
            String segment = segments[i];
            Attribute<?, ?> attribute = attribute(currentType, segment, path);

            if (attribute.isAssociation() || attribute.isCollection()) {
                if (current != currentFrom) {
                    throw new IllegalArgumentException(
                            String.format("Cannot join '%s' from inside an embeddable in path '%s'", segment, path));
                }
                currentFrom = joinOnce(currentFrom, segment);
                current = currentFrom;
                currentType = managedType(elementType(attribute), path);
            } else if (attribute.getPersistentAttributeType() == Attribute.PersistentAttributeType.EMBEDDED) {
                current = current.get(segment);
                currentType = managedType(elementType(attribute), path);
            } else {
                throw new IllegalArgumentException(
                        String.format("Cannot navigate through basic attribute '%s' in path '%s'", segment, path));
            }
        }

        String last = segments[segments.length - 1];
        attribute(currentType, last, path);
        return current.get(last);
    }

    private static From<?, ?> joinOnce(From<?, ?> from, String attribute) {
        return from.getJoins().stream()
                .filter(j -> j.getAttribute().getName().equals(attribute))
                .findFirst()
                .map(j -> (From<?, ?>) j)
                .orElseGet(() -> from.join(attribute, JoinType.LEFT));
    }

    private static Attribute<?, ?> attribute(ManagedType<?> type, String segment, String path) {
        try {
            return type.getAttribute(segment);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    String.format("Unknown attribute '%s' of %s in path '%s'",
                            segment, type.getJavaType().getSimpleName(), path), e);
        }
    }

    private static Type<?> elementType(Attribute<?, ?> attribute) {
        if (attribute instanceof PluralAttribute<?, ?, ?> plural) {
            return plural.getElementType();
        }
        return ((SingularAttribute<?, ?>) attribute).getType();
    }

    private static ManagedType<?> managedType(Object model, String path) {
        if (model instanceof ManagedType<?> managed) {
            return managed;
        }
        if (model instanceof Attribute<?, ?> attribute) {
            return managedType(elementType(attribute), path);
        }
        throw new IllegalArgumentException("Path '" + path + "' does not start from an entity or embeddable");
    }
}
