package com.geoindex.index;

import com.geoindex.model.GeoCoordinates;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared bookkeeping for spatial indexes: the id-to-coordinate map and the exact-match
 * buckets. Subclasses only maintain their region partitioning.
 */
public abstract class AbstractSpatialIndex implements SpatialIndex {

    private static final Logger logger = LoggerFactory.getLogger(AbstractSpatialIndex.class);

    protected static final Envelope WORLD = new Envelope(
            GeoCoordinates.MIN_LON, GeoCoordinates.MAX_LON, GeoCoordinates.MIN_LAT, GeoCoordinates.MAX_LAT);

    // insertion ordered, backs all()
    private final Map<String, Coordinate> positions = new LinkedHashMap<>();

    private final Map<Coordinate, Set<String>> buckets = new HashMap<>();

    @Override
    public void insert(String id, Coordinate coordinate) {
        Coordinate normalized = GeoCoordinates.of(coordinate.x, coordinate.y);
        Coordinate existing = positions.get(id);
        if (existing != null) {
            if (existing.equals2D(normalized)) {
                return;
            }
            remove(id);
        }

        positions.put(id, normalized);
        buckets.computeIfAbsent(normalized, c -> new LinkedHashSet<>()).add(id);
        addToPartition(id, normalized);
    }

    @Override
    public boolean remove(String id) {
        Coordinate coordinate = positions.remove(id);
        if (coordinate == null) {
            return false;
        }

        Set<String> bucket = buckets.get(coordinate);
        if (bucket != null) {
            bucket.remove(id);
            if (bucket.isEmpty()) {
                buckets.remove(coordinate);
            }
        }
        removeFromPartition(id, coordinate);
        return true;
    }

    @Override
    public Set<String> exact(Coordinate coordinate) {
        Set<String> bucket = buckets.get(GeoCoordinates.of(coordinate.x, coordinate.y));
        return bucket == null ? Collections.emptySet() : new LinkedHashSet<>(bucket);
    }

    @Override
    public Set<String> candidates(List<Envelope> regions) {
        Set<String> result = new LinkedHashSet<>();
        for (Envelope region : regions) {
            Envelope clipped = region.intersection(WORLD);
            if (clipped.isNull()) {
                continue;
            }
            collectCandidates(clipped, result);
        }
        logger.debug("{} returned {} candidates for {} region(s) out of {} points",
                getClass().getSimpleName(), result.size(), regions.size(), positions.size());
        return result;
    }

    @Override
    public Set<String> all() {
        return new LinkedHashSet<>(positions.keySet());
    }

    @Override
    public int size() {
        return positions.size();
    }

    @Override
    public void clear() {
        positions.clear();
        buckets.clear();
        clearPartitions();
    }

    protected Coordinate positionOf(String id) {
        return positions.get(id);
    }

    protected abstract void addToPartition(String id, Coordinate coordinate);

    protected abstract void removeFromPartition(String id, Coordinate coordinate);

    /**
     * Add to {@code sink} every id whose partition overlaps the region, which lies inside the world bounds
     */
    protected abstract void collectCandidates(Envelope region, Set<String> sink);

    protected abstract void clearPartitions();
}
