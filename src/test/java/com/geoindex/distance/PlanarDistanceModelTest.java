package com.geoindex.distance;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the degree-space Euclidean metric
 */
public class PlanarDistanceModelTest {

    private final PlanarDistanceModel model = new PlanarDistanceModel();

    @Test
    public void testDistanceIsEuclideanInDegrees() {
        assertEquals(Math.sqrt(41), model.distance(new Coordinate(0, 0), new Coordinate(4, 5)), 1e-12);
        assertEquals(Math.sqrt(100 * 100 + 20 * 20),
                model.distance(new Coordinate(0, 0), new Coordinate(100, 20)), 1e-12);
        assertEquals(10.0, model.distance(new Coordinate(0, 0), new Coordinate(10, 0)));
    }

    @Test
    public void testNoLatitudeCorrection() {
        // one degree of longitude counts the same at 60N as on the equator
        assertEquals(1.0, model.distance(new Coordinate(0, 60), new Coordinate(1, 60)), 1e-12);
        assertEquals(1.0, model.distance(new Coordinate(0, 0), new Coordinate(1, 0)), 1e-12);
    }

    @Test
    public void testSymmetryAndZeroSelfDistance() {
        Random random = new Random(7);
        for (int i = 0; i < 500; i++) {
            Coordinate a = new Coordinate(random.nextDouble() * 360 - 180, random.nextDouble() * 180 - 90);
            Coordinate b = new Coordinate(random.nextDouble() * 360 - 180, random.nextDouble() * 180 - 90);
            assertEquals(model.distance(a, b), model.distance(b, a));
            assertEquals(0.0, model.distance(a, a));
            assertTrue(model.distance(a, b) >= 0);
        }
    }

    @Test
    public void testBoundingRegionCoversRadius() {
        List<Envelope> regions = model.boundingRegions(new Coordinate(5, 5), 3);

        assertEquals(1, regions.size());
        Envelope box = regions.get(0);
        assertTrue(box.covers(2, 5));
        assertTrue(box.covers(8, 8));
        assertFalse(box.covers(8.1, 5));
    }
}
