package com.geoindex.distance;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.List;

/**
 * Metric used to score and filter candidates.
 * <p>
 * Implementations are symmetric, non-negative and return zero for identical coordinates.
 * Coordinates use x = longitude and y = latitude, in degrees.
 */
public interface DistanceModel {

    /**
     * Distance between two coordinates, in the model's own unit
     */
    double distance(Coordinate a, Coordinate b);

    /**
     * Degree-space envelopes that together enclose every coordinate within
     * {@code radius} of {@code origin}. May over-include, never under-include.
     */
    List<Envelope> boundingRegions(Coordinate origin, double radius);

    /**
     * Unit of {@link #distance}, for logging
     */
    String unit();
}
