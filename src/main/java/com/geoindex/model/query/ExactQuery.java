package com.geoindex.model.query;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Matches every point stored at exactly the given coordinate
 */
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class ExactQuery extends GeoQuery {

    public ExactQuery(double lon, double lat) {
        super(lon, lat);
    }

    @Override
    public QueryType getType() {
        return QueryType.EXACT;
    }
}
