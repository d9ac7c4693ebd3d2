package com.geoindex.service;

import com.geoindex.model.Bounds;
import com.geoindex.model.GeoPoint;
import com.geoindex.model.NewPoint;
import com.geoindex.model.query.GeoQuery;
import com.geoindex.model.result.QueryResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Call interface of the embedded geospatial index
 */
public interface GeoIndexService {

    /**
     * Store a point
     *
     * @return the id assigned to the point
     */
    String insert(double lon, double lat, Map<String, Object> payload);

    /**
     * Store a batch of points, all or nothing
     */
    List<GeoPoint> bulkInsert(List<NewPoint> points);

    /**
     * Remove a point; fails with NOT_FOUND for an unknown id
     */
    void remove(String id);

    /**
     * Get a point; fails with NOT_FOUND for an unknown id
     */
    GeoPoint get(String id);

    /**
     * Get a point if present
     */
    Optional<GeoPoint> find(String id);

    /**
     * Evaluate a query
     */
    QueryResult query(GeoQuery query);

    /**
     * Get number of stored points
     */
    long count();

    /**
     * Get bounds of the stored points
     */
    Optional<Bounds> bounds();

    /**
     * Remove every point
     */
    void clear();
}
