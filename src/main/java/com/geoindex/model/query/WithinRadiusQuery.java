package com.geoindex.model.query;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Every point inside the closed disk around a centre, returned without ordering.
 * The radius is in degrees for the planar model and in radians for the spherical model.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class WithinRadiusQuery extends GeoQuery {

    private final double radius;
    private final boolean spherical;

    @Builder
    private WithinRadiusQuery(double lon, double lat, double radius, boolean spherical) {
        super(lon, lat);
        checkThreshold("radius", radius);
        this.radius = radius;
        this.spherical = spherical;
    }

    @Override
    public QueryType getType() {
        return QueryType.WITHIN_RADIUS;
    }
}
