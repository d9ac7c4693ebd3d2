package com.geoindex.model.query;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Points ordered by ascending distance from an origin, optionally bounded by a
 * maximum distance and truncated to a limit.
 * <p>
 * {@code maxDistance} is in degrees for the planar model and in radians for the
 * spherical model.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class NearQuery extends GeoQuery {

    private final Double maxDistance;
    private final Integer limit;
    private final boolean spherical;

    @Builder
    private NearQuery(double lon, double lat, Double maxDistance, Integer limit, boolean spherical) {
        super(lon, lat);
        if (maxDistance != null) {
            checkThreshold("maxDistance", maxDistance);
        }
        if (limit != null) {
            checkLimit(limit);
        }
        this.maxDistance = maxDistance;
        this.limit = limit;
        this.spherical = spherical;
    }

    public boolean hasMaxDistance() {
        return maxDistance != null;
    }

    public boolean hasLimit() {
        return limit != null;
    }

    @Override
    public QueryType getType() {
        return QueryType.NEAR;
    }
}
