package com.geoindex.index.impl;

import com.geoindex.index.AbstractSpatialIndex;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Fixed-resolution cell grid over longitude/latitude.
 * <p>
 * Coarser cells keep the grid small but hand more false positives to the distance model;
 * finer cells do the opposite. Only occupied cells are stored.
 */
public class GridSpatialIndex extends AbstractSpatialIndex {

    public static final double DEFAULT_CELL_SIZE = 1.0d;

    private final double cellSize;

    private final Map<Long, Set<String>> cells = new HashMap<>();

    public GridSpatialIndex() {
        this(DEFAULT_CELL_SIZE);
    }

    public GridSpatialIndex(double cellSize) {
        if (!(cellSize > 0) || Double.isInfinite(cellSize)) {
            throw new IllegalArgumentException("Grid cell size must be a positive finite number: " + cellSize);
        }
        if (360.0d / cellSize >= Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Grid cell size too small: " + cellSize);
        }
        this.cellSize = cellSize;
    }

    public double getCellSize() {
        return cellSize;
    }

    /**
     * Number of occupied cells
     */
    public int cellCount() {
        return cells.size();
    }

    @Override
    protected void addToPartition(String id, Coordinate coordinate) {
        cells.computeIfAbsent(cellKey(coordinate.x, coordinate.y), k -> new LinkedHashSet<>()).add(id);
    }

    @Override
    protected void removeFromPartition(String id, Coordinate coordinate) {
        long key = cellKey(coordinate.x, coordinate.y);
        Set<String> cell = cells.get(key);
        if (cell != null) {
            cell.remove(id);
            if (cell.isEmpty()) {
                cells.remove(key);
            }
        }
    }

    @Override
    protected void collectCandidates(Envelope region, Set<String> sink) {
        int minX = column(region.getMinX());
        int maxX = column(region.getMaxX());
        int minY = row(region.getMinY());
        int maxY = row(region.getMaxY());

        long covered = (long) (maxX - minX + 1) * (long) (maxY - minY + 1);
        if (covered > cells.size()) {
            // sparse grid: cheaper to walk the occupied cells than the covered ones
            for (Map.Entry<Long, Set<String>> entry : cells.entrySet()) {
                long key = entry.getKey();
                int x = (int) (key >>> 32);
                int y = (int) key;
                if (x >= minX && x <= maxX && y >= minY && y <= maxY) {
                    sink.addAll(entry.getValue());
                }
            }
            return;
        }

        for (int x = minX; x <= maxX; x++) {
            for (int y = minY; y <= maxY; y++) {
                Set<String> cell = cells.get(pack(x, y));
                if (cell != null) {
                    sink.addAll(cell);
                }
            }
        }
    }

    @Override
    protected void clearPartitions() {
        cells.clear();
    }

    private long cellKey(double lon, double lat) {
        return pack(column(lon), row(lat));
    }

    private int column(double lon) {
        return (int) Math.floor((lon + 180.0d) / cellSize);
    }

    private int row(double lat) {
        return (int) Math.floor((lat + 90.0d) / cellSize);
    }

    private static long pack(int x, int y) {
        return ((long) x << 32) | (y & 0xffffffffL);
    }
}
