package com.geoindex.distance;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Euclidean distance computed directly on longitude/latitude degrees.
 * No cosine-latitude correction is applied.
 */
@Component
public class PlanarDistanceModel implements DistanceModel {

    // Widens search boxes so that rounding at the boundary cannot drop a match
    static final double BOX_PADDING_DEGREES = 1e-9;

    @Override
    public double distance(Coordinate a, Coordinate b) {
        double dx = a.x - b.x;
        double dy = a.y - b.y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    @Override
    public List<Envelope> boundingRegions(Coordinate origin, double radius) {
        double r = radius + BOX_PADDING_DEGREES;
        return List.of(new Envelope(origin.x - r, origin.x + r, origin.y - r, origin.y + r));
    }

    @Override
    public String unit() {
        return "degrees";
    }
}
