package io.github.cyfko.whereql.core.geo;

/**
 * Operand of proximity operators: a geometry and the distance around it.
 *
 * @param geometry the reference geometry
 * @param distance the non-zero distance, in the units of the backend's spatial reference
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record GeoDistance(Geometry geometry, double distance) {

    public GeoDistance {
        if (geometry == null) {
            throw new IllegalArgumentException("geometry is required");
        }
        if (!Double.isFinite(distance) || distance == 0) {
            throw new IllegalArgumentException("distance must be a finite non-zero number, got: " + distance);
        }
    }
}
