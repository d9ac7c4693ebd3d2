package com.geoindex.distance;

import com.geoindex.model.GeoCoordinates;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Great-circle distance on the unit sphere via the haversine formula, in radians.
 */
@Component
public class SphericalDistanceModel implements DistanceModel {

    private static final double BOX_PADDING_DEGREES = PlanarDistanceModel.BOX_PADDING_DEGREES;

    private static final Envelope WORLD = new Envelope(
            GeoCoordinates.MIN_LON, GeoCoordinates.MAX_LON, GeoCoordinates.MIN_LAT, GeoCoordinates.MAX_LAT);

    @Override
    public double distance(Coordinate a, Coordinate b) {
        double lat1 = Math.toRadians(a.y);
        double lat2 = Math.toRadians(b.y);
        double sinHalfLat = Math.sin(Math.toRadians(b.y - a.y) * 0.5d);
        double sinHalfLon = Math.sin(Math.toRadians(b.x - a.x) * 0.5d);

        double h = sinHalfLat * sinHalfLat
                + Math.cos(lat1) * Math.cos(lat2) * sinHalfLon * sinHalfLon;
        // rounding can push h slightly outside [0, 1]
        h = Math.min(1.0d, Math.max(0.0d, h));
        return 2.0d * Math.asin(Math.sqrt(h));
    }

    @Override
    public List<Envelope> boundingRegions(Coordinate origin, double radius) {
        if (radius >= Math.PI) {
            return List.of(WORLD);
        }

        double radiusDegrees = Math.toDegrees(radius) + BOX_PADDING_DEGREES;
        double minLat = origin.y - radiusDegrees;
        double maxLat = origin.y + radiusDegrees;

        if (minLat <= GeoCoordinates.MIN_LAT || maxLat >= GeoCoordinates.MAX_LAT) {
            // a pole is within the distance, every longitude qualifies
            return List.of(new Envelope(GeoCoordinates.MIN_LON, GeoCoordinates.MAX_LON,
                    Math.max(minLat, GeoCoordinates.MIN_LAT), Math.min(maxLat, GeoCoordinates.MAX_LAT)));
        }

        double ratio = Math.sin(radius) / Math.cos(Math.toRadians(origin.y));
        if (ratio >= 1.0d) {
            return List.of(new Envelope(GeoCoordinates.MIN_LON, GeoCoordinates.MAX_LON, minLat, maxLat));
        }
        double deltaLon = Math.toDegrees(Math.asin(ratio)) + BOX_PADDING_DEGREES;
        double minLon = origin.x - deltaLon;
        double maxLon = origin.x + deltaLon;

        if (maxLon - minLon >= 360.0d) {
            return List.of(new Envelope(GeoCoordinates.MIN_LON, GeoCoordinates.MAX_LON, minLat, maxLat));
        }
        if (minLon < GeoCoordinates.MIN_LON) {
            return List.of(
                    new Envelope(GeoCoordinates.MIN_LON, maxLon, minLat, maxLat),
                    new Envelope(minLon + 360.0d, GeoCoordinates.MAX_LON, minLat, maxLat));
        }
        if (maxLon > GeoCoordinates.MAX_LON) {
            return List.of(
                    new Envelope(minLon, GeoCoordinates.MAX_LON, minLat, maxLat),
                    new Envelope(GeoCoordinates.MIN_LON, maxLon - 360.0d, minLat, maxLat));
        }
        return List.of(new Envelope(minLon, maxLon, minLat, maxLat));
    }

    @Override
    public String unit() {
        return "radians";
    }
}
