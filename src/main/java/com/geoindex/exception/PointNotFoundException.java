package com.geoindex.exception;

import lombok.Getter;

/**
 * Thrown when an id does not name a stored point
 */
@Getter
public class PointNotFoundException extends GeoIndexException {

    private final String id;

    public PointNotFoundException(String id) {
        super(ErrorKind.NOT_FOUND, "Point not found: " + id);
        this.id = id;
    }
}
