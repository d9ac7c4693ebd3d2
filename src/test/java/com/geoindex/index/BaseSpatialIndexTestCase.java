package com.geoindex.index;

import com.geoindex.distance.DistanceModel;
import com.geoindex.distance.PlanarDistanceModel;
import com.geoindex.distance.SphericalDistanceModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link SpatialIndex} implementation must show.
 * Subclasses supply the implementation under test.
 */
public abstract class BaseSpatialIndexTestCase {

    protected SpatialIndex index;

    private final PlanarDistanceModel planar = new PlanarDistanceModel();
    private final SphericalDistanceModel spherical = new SphericalDistanceModel();

    protected abstract SpatialIndex newIndex();

    @BeforeEach
    public void setUp() {
        index = newIndex();
    }

    @Test
    public void testExactReturnsAllPointsAtCoordinate() {
        index.insert("a", new Coordinate(50, 30));
        index.insert("b", new Coordinate(50, 30));
        index.insert("c", new Coordinate(50, 30.0001));

        assertEquals(Set.of("a", "b"), index.exact(new Coordinate(50, 30)));
        assertEquals(Set.of("c"), index.exact(new Coordinate(50, 30.0001)));
        assertTrue(index.exact(new Coordinate(0, 0)).isEmpty());
    }

    @Test
    public void testNegativeZeroMatchesZero() {
        index.insert("origin", new Coordinate(-0.0, -0.0));

        assertEquals(Set.of("origin"), index.exact(new Coordinate(0.0, 0.0)));
    }

    @Test
    public void testInsertIsIdempotentPerId() {
        index.insert("a", new Coordinate(1, 1));
        index.insert("a", new Coordinate(1, 1));

        assertEquals(1, index.size());
        assertEquals(Set.of("a"), index.exact(new Coordinate(1, 1)));
    }

    @Test
    public void testReinsertMovesPoint() {
        index.insert("a", new Coordinate(1, 1));
        index.insert("a", new Coordinate(-40, 20));

        assertEquals(1, index.size());
        assertTrue(index.exact(new Coordinate(1, 1)).isEmpty());
        assertEquals(Set.of("a"), index.exact(new Coordinate(-40, 20)));
        assertFalse(index.candidatesNear(new Coordinate(1, 1), 0.5, planar).contains("a"));
        assertTrue(index.candidatesNear(new Coordinate(-40, 20), 0.5, planar).contains("a"));
    }

    @Test
    public void testRemove() {
        index.insert("a", new Coordinate(3, 3));
        index.insert("b", new Coordinate(3, 3));

        assertTrue(index.remove("a"));
        assertFalse(index.remove("a"));
        assertFalse(index.remove("unknown"));

        assertEquals(Set.of("b"), index.exact(new Coordinate(3, 3)));
        assertEquals(Set.of("b"), index.candidatesNear(new Coordinate(3, 3), 1, planar));
        assertEquals(1, index.size());
    }

    @Test
    public void testAllKeepsInsertionOrder() {
        index.insert("first", new Coordinate(100, 20));
        index.insert("second", new Coordinate(0, 0));
        index.insert("third", new Coordinate(4, 5));

        assertEquals(List.of("first", "second", "third"), new ArrayList<>(index.all()));
    }

    @Test
    public void testClear() {
        index.insert("a", new Coordinate(3, 3));
        index.insert("b", new Coordinate(-3, -3));
        index.clear();

        assertEquals(0, index.size());
        assertTrue(index.all().isEmpty());
        assertTrue(index.exact(new Coordinate(3, 3)).isEmpty());
        assertTrue(index.candidatesNear(new Coordinate(0, 0), 180, planar).isEmpty());
    }

    @Test
    public void testCandidatesPruneDistantPoints() {
        index.insert("near", new Coordinate(0.5, 0.5));
        index.insert("far", new Coordinate(120, -60));

        Set<String> candidates = index.candidatesNear(new Coordinate(0, 0), 1, planar);
        assertTrue(candidates.contains("near"));
        assertFalse(candidates.contains("far"));
    }

    @Test
    public void testPointsOnTheWorldEdge() {
        index.insert("east", new Coordinate(180, 0));
        index.insert("west", new Coordinate(-180, 0));
        index.insert("north", new Coordinate(0, 90));
        index.insert("south", new Coordinate(0, -90));

        Set<String> candidates = index.candidatesNear(new Coordinate(179, 0), Math.toRadians(2), spherical);
        assertTrue(candidates.contains("east"));
        assertTrue(candidates.contains("west"));
        assertTrue(index.candidatesNear(new Coordinate(90, 89), Math.toRadians(2), spherical).contains("north"));
        assertTrue(index.candidatesNear(new Coordinate(0, -89.5), 1, planar).contains("south"));
    }

    @Test
    public void testCandidatesNeverMissAPointInRange() {
        Random random = new Random(42);
        Map<String, Coordinate> points = new HashMap<>();
        for (int i = 0; i < 2000; i++) {
            Coordinate coordinate;
            if (i % 10 == 0) {
                // whole degrees land on cell edges
                coordinate = new Coordinate(random.nextInt(361) - 180, random.nextInt(181) - 90);
            } else {
                coordinate = new Coordinate(random.nextDouble() * 360 - 180, random.nextDouble() * 180 - 90);
            }
            points.put("p" + i, coordinate);
            index.insert("p" + i, coordinate);
        }

        for (int q = 0; q < 200; q++) {
            Coordinate origin = new Coordinate(random.nextDouble() * 360 - 180, random.nextDouble() * 180 - 90);
            boolean useSpherical = q % 2 == 0;
            DistanceModel model = useSpherical ? spherical : planar;
            double radius = useSpherical ? random.nextDouble() * 0.5 : random.nextDouble() * 30;

            Set<String> candidates = index.candidatesNear(origin, radius, model);
            for (Map.Entry<String, Coordinate> entry : points.entrySet()) {
                if (model.distance(origin, entry.getValue()) <= radius) {
                    assertTrue(candidates.contains(entry.getKey()),
                            "missed " + entry.getKey() + " at " + entry.getValue() + " for origin " + origin
                                    + " radius " + radius + " (" + model.unit() + ")");
                }
            }
        }
    }

    @Test
    public void testBoundaryPointIsCandidate() {
        index.insert("edge", new Coordinate(10, 0));

        assertTrue(index.candidatesNear(new Coordinate(0, 0), 10, planar).contains("edge"));
        assertTrue(index.candidatesNear(new Coordinate(0, 0), Math.toRadians(10), spherical).contains("edge"));
    }
}
