package io.github.cyfko.whereql.core.geo;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Geometry kinds accepted in filter literals, with their constructors.
 * <p>
 * Each kind turns a coordinate tuple (nested immutable lists of {@link Double}) into a
 * {@link Geometry}, checking the arity its shape requires:
 * </p>
 * <ul>
 *   <li>{@link #POINT}: {@code [x, y]}</li>
 *   <li>{@link #LINE_STRING}: {@code [[x, y], [x, y], ...]}, at least two positions</li>
 *   <li>{@link #POLYGON}: {@code [[[x, y], ...], ...]}, closed rings of at least four positions</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum GeometryKind {

    POINT(Set.of("POINT")) {
        @Override
        Geometry construct(List<?> coordinates) {
            return new Geometry.Point(position(coordinates));
        }
    },

    LINE_STRING(Set.of("LINE", "LINESTRING")) {
        @Override
        Geometry construct(List<?> coordinates) {
            return new Geometry.LineString(positions(coordinates));
        }
    },

    POLYGON(Set.of("POLYGON")) {
        @Override
        Geometry construct(List<?> coordinates) {
            List<List<Position>> rings = new ArrayList<>();
            for (Object ring : coordinates) {
                rings.add(positions(asList(ring)));
            }
            return new Geometry.Polygon(rings);
        }
    };

    private final Set<String> names;

    GeometryKind(Set<String> names) {
        this.names = names;
    }

    /**
     * Finds a kind by one of its literal names, ignoring case.
     *
     * @param name literal name such as {@code point} or {@code LineString}
     * @return the matching kind, or empty if none matches
     */
    public static Optional<GeometryKind> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String upper = name.trim().toUpperCase(Locale.ROOT);
        for (GeometryKind kind : values()) {
            if (kind.names.contains(upper)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Builds a geometry of this kind.
     *
     * @param coordinates coordinate tuple whose leaves are {@link Double}s
     * @return the geometry
     * @throws IllegalArgumentException if the tuple does not have the shape this kind needs
     */
    abstract Geometry construct(List<?> coordinates);

    private static Position position(Object tuple) {
        List<?> pair = asList(tuple);
        if (pair.size() != 2 || !(pair.get(0) instanceof Double x) || !(pair.get(1) instanceof Double y)) {
            throw new IllegalArgumentException("A position needs exactly 2 numbers: " + tuple);
        }
        return new Position(x, y);
    }

    private static List<Position> positions(List<?> tuples) {
        List<Position> positions = new ArrayList<>(tuples.size());
        for (Object tuple : tuples) {
            positions.add(position(tuple));
        }
        return positions;
    }

    private static List<?> asList(Object value) {
        if (value instanceof List<?> list) {
            return list;
        }
        throw new IllegalArgumentException("Expected a coordinate list, got: " + value);
    }
}
