package io.github.cyfko.whereql.core.geo;

import java.util.Arrays;
import java.util.List;

/**
 * Geometry value decoded from a filter literal.
 * <p>
 * Geometries are plain immutable values: two geometries with the same kind and the
 * same coordinates are equal, whether they were decoded from JSON or built through
 * the factory methods below.
 * </p>
 * <pre>{@code
 * Geometry decoded = GeometryDecoder.decode(Map.of("type", "point", "coordinates", List.of(1, 2))).getValue();
 * assert decoded.equals(Geometry.point(1, 2));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see GeometryDecoder
 */
public interface Geometry {

    /**
     * @return the kind of this geometry
     */
    GeometryKind kind();

    /**
     * @return the Well-Known Text representation, e.g. {@code POINT(1 2)}
     */
    String toWkt();

    static Point point(double x, double y) {
        return new Point(new Position(x, y));
    }

    static LineString lineString(Position... positions) {
        return new LineString(Arrays.asList(positions));
    }

    @SafeVarargs
    static Polygon polygon(List<Position>... rings) {
        return new Polygon(Arrays.asList(rings));
    }

    /**
     * A single position.
     *
     * @param position the location of the point
     */
    record Point(Position position) implements Geometry {

        public Point {
            if (position == null) {
                throw new IllegalArgumentException("A point needs a position");
            }
        }

        @Override
        public GeometryKind kind() {
            return GeometryKind.POINT;
        }

        @Override
        public String toWkt() {
            return "POINT(" + position.toWkt() + ")";
        }
    }

    /**
     * An open path of two or more positions.
     *
     * @param positions the vertices, in order
     */
    record LineString(List<Position> positions) implements Geometry {

        public LineString {
            positions = List.copyOf(positions);
            if (positions.size() < 2) {
                throw new IllegalArgumentException("A line needs at least 2 positions, got " + positions.size());
            }
        }

        @Override
        public GeometryKind kind() {
            return GeometryKind.LINE_STRING;
        }

        @Override
        public String toWkt() {
            return "LINESTRING" + ring(positions);
        }
    }

    /**
     * A surface bounded by an exterior ring and optional holes.
     *
     * @param rings closed rings, exterior first
     */
    record Polygon(List<List<Position>> rings) implements Geometry {

        public Polygon {
            if (rings.isEmpty()) {
                throw new IllegalArgumentException("A polygon needs at least one ring");
            }
            rings = rings.stream().map(List::copyOf).toList();
            for (List<Position> ring : rings) {
                if (ring.size() < 4) {
                    throw new IllegalArgumentException("A polygon ring needs at least 4 positions, got " + ring.size());
                }
                if (!ring.get(0).equals(ring.get(ring.size() - 1))) {
                    throw new IllegalArgumentException("A polygon ring must be closed");
                }
            }
        }

        @Override
        public GeometryKind kind() {
            return GeometryKind.POLYGON;
        }

        @Override
        public String toWkt() {
            StringBuilder wkt = new StringBuilder("POLYGON(");
            for (int i = 0; i < rings.size(); i++) {
                if (i > 0) wkt.append(", ");
                wkt.append(ring(rings.get(i)));
            }
            return wkt.append(')').toString();
        }
    }

    private static String ring(List<Position> positions) {
        StringBuilder wkt = new StringBuilder("(");
        for (int i = 0; i < positions.size(); i++) {
            if (i > 0) wkt.append(", ");
            wkt.append(positions.get(i).toWkt());
        }
        return wkt.append(')').toString();
    }
}
