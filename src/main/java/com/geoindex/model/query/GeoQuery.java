package com.geoindex.model.query;

import com.geoindex.exception.InvalidParameterException;
import com.geoindex.model.GeoCoordinates;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.locationtech.jts.geom.Coordinate;

/**
 * Base class for the typed query variants. Every variant is validated when it is built,
 * so the engine only ever sees well-formed queries.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class GeoQuery {

    private final double lon;
    private final double lat;

    protected GeoQuery(double lon, double lat) {
        GeoCoordinates.validate(lon, lat);
        this.lon = lon;
        this.lat = lat;
    }

    public abstract QueryType getType();

    public Coordinate getOrigin() {
        return GeoCoordinates.of(lon, lat);
    }

    public static ExactQuery exact(double lon, double lat) {
        return new ExactQuery(lon, lat);
    }

    public static NearQuery.NearQueryBuilder near(double lon, double lat) {
        return NearQuery.builder().lon(lon).lat(lat);
    }

    public static WithinRadiusQuery.WithinRadiusQueryBuilder withinRadius(double lon, double lat, double radius) {
        return WithinRadiusQuery.builder().lon(lon).lat(lat).radius(radius);
    }

    static void checkThreshold(String name, double value) {
        if (Double.isNaN(value) || value < 0) {
            throw new InvalidParameterException(name + " must be a non-negative number, got " + value);
        }
    }

    static void checkLimit(int limit) {
        if (limit <= 0) {
            throw new InvalidParameterException("limit must be positive, got " + limit);
        }
    }
}
