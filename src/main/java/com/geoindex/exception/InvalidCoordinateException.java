package com.geoindex.exception;

/**
 * Thrown when a longitude or latitude lies outside its valid range
 */
public class InvalidCoordinateException extends GeoIndexException {

    public InvalidCoordinateException(double lon, double lat) {
        super(ErrorKind.INVALID_COORDINATE,
                "Invalid coordinates: lon=" + lon + ", lat=" + lat
                        + " (expected lon in [-180, 180], lat in [-90, 90])");
    }
}
