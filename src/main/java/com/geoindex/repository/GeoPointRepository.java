package com.geoindex.repository;

import com.geoindex.distance.DistanceModel;
import com.geoindex.model.Bounds;
import com.geoindex.model.GeoPoint;
import com.geoindex.model.NewPoint;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Store of point records. Owns the spatial index and keeps both in step.
 * Every read method observes a single consistent state of points and index.
 */
public interface GeoPointRepository {

    /**
     * Store a point and index its coordinate
     */
    GeoPoint insert(double lon, double lat, Map<String, Object> payload);

    /**
     * Store a batch of points. Either every record is stored or none is.
     */
    List<GeoPoint> bulkInsert(List<NewPoint> points);

    /**
     * Remove a point from the store and the index
     *
     * @return the removed point
     */
    GeoPoint remove(String id);

    /**
     * Get a point by id
     */
    Optional<GeoPoint> get(String id);

    /**
     * Points located exactly at the coordinate
     */
    List<GeoPoint> findAt(double lon, double lat);

    /**
     * Candidate points for a radius search: a superset of the points within
     * {@code radius} of {@code origin} under the given model
     */
    List<GeoPoint> findCandidatesNear(Coordinate origin, double radius, DistanceModel model);

    /**
     * Every stored point, in insertion order
     */
    List<GeoPoint> findAll();

    /**
     * Get number of stored points
     */
    long count();

    /**
     * Bounding box of the stored points, empty when the store is empty
     */
    Optional<Bounds> bounds();

    /**
     * Remove every point
     */
    void clear();
}
