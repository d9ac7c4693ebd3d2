package com.geoindex.model;

import lombok.Builder;
import lombok.Value;
import org.locationtech.jts.geom.Coordinate;

import java.util.Map;

/**
 * A stored point record. Immutable once stored; an update is a remove followed by an insert.
 */
@Value
@Builder
public class GeoPoint {

    /**
     * Opaque identifier assigned by the store
     */
    String id;

    double lon;

    double lat;

    /**
     * Unmodifiable payload attached to the point
     */
    Map<String, Object> payload;

    /**
     * Store-wide insertion counter, used to break distance ties
     */
    long sequence;

    /**
     * Insertion time in epoch milliseconds
     */
    long timestamp;

    public Coordinate getCoordinate() {
        return GeoCoordinates.of(lon, lat);
    }

    public Object getPayloadValue(String key) {
        return payload != null ? payload.get(key) : null;
    }
}
