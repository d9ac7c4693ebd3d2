package com.geoindex.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.locationtech.jts.geom.Envelope;

/**
 * Bounds represents the bounding box of all stored points
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Bounds {
    private double minLon;
    private double minLat;
    private double maxLon;
    private double maxLat;

    public static Bounds of(Envelope envelope) {
        return Bounds.builder()
                .minLon(envelope.getMinX())
                .minLat(envelope.getMinY())
                .maxLon(envelope.getMaxX())
                .maxLat(envelope.getMaxY())
                .build();
    }

    public boolean contains(double lon, double lat) {
        return lon >= minLon && lon <= maxLon && lat >= minLat && lat <= maxLat;
    }
}
