package com.geoindex.index.impl;

import com.geoindex.distance.PlanarDistanceModel;
import com.geoindex.index.BaseSpatialIndexTestCase;
import com.geoindex.index.SpatialIndex;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class GridSpatialIndexTest extends BaseSpatialIndexTestCase {

    @Override
    protected SpatialIndex newIndex() {
        return new GridSpatialIndex(1.0);
    }

    @Test
    public void testOnlyOccupiedCellsAreKept() {
        GridSpatialIndex grid = new GridSpatialIndex(10.0);
        grid.insert("a", new Coordinate(1, 1));
        grid.insert("b", new Coordinate(2, 2));
        grid.insert("c", new Coordinate(-55, 45));

        assertEquals(2, grid.cellCount());

        grid.remove("c");
        assertEquals(1, grid.cellCount());
    }

    @Test
    public void testCoarseCellsOverInclude() {
        GridSpatialIndex grid = new GridSpatialIndex(10.0);
        grid.insert("inside", new Coordinate(1, 1));
        grid.insert("sameCell", new Coordinate(9, 9));

        Set<String> candidates = grid.candidatesNear(new Coordinate(1, 1), 0.5, new PlanarDistanceModel());
        assertEquals(Set.of("inside", "sameCell"), candidates);
    }

    @Test
    public void testFineCellsPrune() {
        GridSpatialIndex grid = new GridSpatialIndex(0.25);
        grid.insert("inside", new Coordinate(1, 1));
        grid.insert("outside", new Coordinate(9, 9));

        Set<String> candidates = grid.candidatesNear(new Coordinate(1, 1), 0.5, new PlanarDistanceModel());
        assertEquals(Set.of("inside"), candidates);
    }

    @Test
    public void testRejectsInvalidCellSize() {
        assertThrows(IllegalArgumentException.class, () -> new GridSpatialIndex(0));
        assertThrows(IllegalArgumentException.class, () -> new GridSpatialIndex(-1));
        assertThrows(IllegalArgumentException.class, () -> new GridSpatialIndex(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> new GridSpatialIndex(1e-12));
    }
}
