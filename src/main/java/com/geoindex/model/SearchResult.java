package com.geoindex.model;

import lombok.Builder;
import lombok.Value;

/**
 * A single query match: the point and, for ranked queries, its distance from the origin
 */
@Value
@Builder
public class SearchResult {

    GeoPoint point;

    /**
     * Distance in the unit of the query's distance model, null when not reported
     */
    Double distance;

    public String getId() {
        return point.getId();
    }

    public boolean hasDistance() {
        return distance != null;
    }
}
