package com.geoindex.index;

import com.geoindex.distance.DistanceModel;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.List;
import java.util.Set;

/**
 * Positional index over point coordinates, keyed by point id.
 * <p>
 * The index only finds candidates; scoring them is the caller's job. Implementations are
 * not thread-safe, the owning store serializes mutations against reads.
 */
public interface SpatialIndex {

    /**
     * Index a point. Idempotent per id; an id indexed at another coordinate is moved.
     */
    void insert(String id, Coordinate coordinate);

    /**
     * Remove a point from the index
     *
     * @return whether the id was indexed
     */
    boolean remove(String id);

    /**
     * Ids of all points located exactly at the coordinate
     */
    Set<String> exact(Coordinate coordinate);

    /**
     * Superset of the ids located inside any of the envelopes. Never misses a point.
     */
    Set<String> candidates(List<Envelope> regions);

    /**
     * Candidates for every point within {@code radius} of {@code origin} under the given model
     */
    default Set<String> candidatesNear(Coordinate origin, double radius, DistanceModel model) {
        return candidates(model.boundingRegions(origin, radius));
    }

    /**
     * Every indexed id, in insertion order
     */
    Set<String> all();

    /**
     * Number of indexed points
     */
    int size();

    /**
     * Drop all entries
     */
    void clear();
}
