package com.geoindex.distance;

import lombok.Getter;

/**
 * Converts physical distances into the thresholds each distance model consumes.
 * The engine never converts by itself; callers use this before building a query.
 */
@Getter
public class GeoUnits {

    public static final double DEFAULT_EARTH_RADIUS_KM = 6371.0d;

    private final double earthRadiusKm;

    public GeoUnits() {
        this(DEFAULT_EARTH_RADIUS_KM);
    }

    public GeoUnits(double earthRadiusKm) {
        if (!(earthRadiusKm > 0) || Double.isInfinite(earthRadiusKm)) {
            throw new IllegalArgumentException("Earth radius must be a positive finite number: " + earthRadiusKm);
        }
        this.earthRadiusKm = earthRadiusKm;
    }

    /**
     * Planar threshold: degree = km / (earth radius * PI / 180)
     */
    public double kmToDegrees(double km) {
        return km / (earthRadiusKm * Math.PI / 180.0d);
    }

    /**
     * Spherical threshold: radian = km / earth radius
     */
    public double kmToRadians(double km) {
        return km / earthRadiusKm;
    }

    public double radiansToKm(double radians) {
        return radians * earthRadiusKm;
    }

    public double degreesToKm(double degrees) {
        return degrees * earthRadiusKm * Math.PI / 180.0d;
    }
}
