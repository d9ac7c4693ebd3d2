package com.geoindex.model;

import com.geoindex.exception.InvalidCoordinateException;
import org.locationtech.jts.geom.Coordinate;

/**
 * Range checks and normalisation for longitude/latitude pairs
 */
public final class GeoCoordinates {

    public static final double MIN_LON = -180.0;
    public static final double MAX_LON = 180.0;
    public static final double MIN_LAT = -90.0;
    public static final double MAX_LAT = 90.0;

    private GeoCoordinates() {
    }

    /**
     * Check if the pair is inside the valid range; NaN is never valid
     */
    public static boolean isValid(double lon, double lat) {
        return lat >= MIN_LAT && lat <= MAX_LAT &&
               lon >= MIN_LON && lon <= MAX_LON;
    }

    /**
     * Fail with {@link InvalidCoordinateException} unless the pair is valid
     */
    public static void validate(double lon, double lat) {
        if (!isValid(lon, lat)) {
            throw new InvalidCoordinateException(lon, lat);
        }
    }

    /**
     * Create a JTS coordinate (x = lon, y = lat) with negative zero folded into zero,
     * so that equal coordinates also hash equally.
     */
    public static Coordinate of(double lon, double lat) {
        return new Coordinate(lon + 0.0d, lat + 0.0d);
    }
}
