package io.github.cyfko.whereql.core.geo;

import java.math.BigDecimal;

/**
 * A single coordinate pair.
 *
 * @param x longitude or easting
 * @param y latitude or northing
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Position(double x, double y) {

    public Position {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("Coordinates must be finite numbers: " + x + ", " + y);
        }
    }

    /**
     * @return the pair as WKT, e.g. {@code 1 2.5}
     */
    String toWkt() {
        return format(x) + " " + format(y);
    }

    private static String format(double coordinate) {
        return BigDecimal.valueOf(coordinate).stripTrailingZeros().toPlainString();
    }
}
