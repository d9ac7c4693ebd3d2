package com.geoindex.exception;

/**
 * Thrown for a negative distance threshold or a non-positive limit
 */
public class InvalidParameterException extends GeoIndexException {

    public InvalidParameterException(String message) {
        super(ErrorKind.INVALID_PARAMETER, message);
    }
}
