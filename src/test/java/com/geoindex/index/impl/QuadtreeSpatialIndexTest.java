package com.geoindex.index.impl;

import com.geoindex.distance.PlanarDistanceModel;
import com.geoindex.index.BaseSpatialIndexTestCase;
import com.geoindex.index.SpatialIndex;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class QuadtreeSpatialIndexTest extends BaseSpatialIndexTestCase {

    @Override
    protected SpatialIndex newIndex() {
        return new QuadtreeSpatialIndex();
    }

    @Test
    public void testCandidatesAreInsideTheSearchBox() {
        QuadtreeSpatialIndex quadtree = new QuadtreeSpatialIndex();
        for (int i = 0; i < 100; i++) {
            quadtree.insert("p" + i, new Coordinate(i * 0.1, i * 0.1));
        }

        Set<String> candidates = quadtree.candidatesNear(new Coordinate(0, 0), 0.25, new PlanarDistanceModel());
        assertEquals(Set.of("p0", "p1", "p2"), candidates);
    }

    @Test
    public void testClearResetsTree() {
        QuadtreeSpatialIndex quadtree = new QuadtreeSpatialIndex();
        quadtree.insert("a", new Coordinate(5, 5));
        quadtree.clear();
        quadtree.insert("b", new Coordinate(5, 5));

        assertEquals(Set.of("b"), quadtree.candidatesNear(new Coordinate(5, 5), 1, new PlanarDistanceModel()));
    }
}
