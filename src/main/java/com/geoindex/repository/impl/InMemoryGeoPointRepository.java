package com.geoindex.repository.impl;

import com.geoindex.distance.DistanceModel;
import com.geoindex.exception.PointNotFoundException;
import com.geoindex.index.SpatialIndex;
import com.geoindex.model.Bounds;
import com.geoindex.model.GeoCoordinates;
import com.geoindex.model.GeoPoint;
import com.geoindex.model.NewPoint;
import com.geoindex.repository.GeoPointRepository;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory implementation of GeoPointRepository.
 * <p>
 * One read/write lock guards the point map and the spatial index together: queries run
 * concurrently, inserts and removals are exclusive.
 */
public class InMemoryGeoPointRepository implements GeoPointRepository {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryGeoPointRepository.class);

    private final SpatialIndex spatialIndex;

    // single source of truth for point storage, insertion ordered
    private final Map<String, GeoPoint> storage = new LinkedHashMap<>();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private long nextSequence;

    public InMemoryGeoPointRepository(SpatialIndex spatialIndex) {
        this.spatialIndex = spatialIndex;
    }

    @Override
    public GeoPoint insert(double lon, double lat, Map<String, Object> payload) {
        GeoCoordinates.validate(lon, lat);

        lock.writeLock().lock();
        try {
            GeoPoint point = store(lon, lat, payload);
            logger.debug("Inserted point {} at ({}, {})", point.getId(), lon, lat);
            return point;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<GeoPoint> bulkInsert(List<NewPoint> points) {
        if (points == null || points.isEmpty()) {
            return Collections.emptyList();
        }
        for (NewPoint point : points) {
            GeoCoordinates.validate(point.getLon(), point.getLat());
        }

        logger.info("Starting bulk insert of {} points", points.size());
        long startTime = System.currentTimeMillis();

        List<GeoPoint> stored = new ArrayList<>(points.size());
        lock.writeLock().lock();
        try {
            for (NewPoint point : points) {
                stored.add(store(point.getLon(), point.getLat(), point.getPayload()));
            }
        } finally {
            lock.writeLock().unlock();
        }

        logger.info("Completed bulk insert of {} points in {}ms", stored.size(), System.currentTimeMillis() - startTime);
        return stored;
    }

    @Override
    public GeoPoint remove(String id) {
        lock.writeLock().lock();
        try {
            GeoPoint point = storage.remove(id);
            if (point == null) {
                throw new PointNotFoundException(id);
            }
            spatialIndex.remove(id);
            logger.debug("Removed point {}", id);
            return point;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<GeoPoint> get(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(storage.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<GeoPoint> findAt(double lon, double lat) {
        lock.readLock().lock();
        try {
            return resolve(spatialIndex.exact(GeoCoordinates.of(lon, lat)));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<GeoPoint> findCandidatesNear(Coordinate origin, double radius, DistanceModel model) {
        lock.readLock().lock();
        try {
            return resolve(spatialIndex.candidatesNear(origin, radius, model));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<GeoPoint> findAll() {
        lock.readLock().lock();
        try {
            return resolve(spatialIndex.all());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long count() {
        lock.readLock().lock();
        try {
            return storage.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Bounds> bounds() {
        lock.readLock().lock();
        try {
            if (storage.isEmpty()) {
                return Optional.empty();
            }
            Envelope envelope = new Envelope();
            for (GeoPoint point : storage.values()) {
                envelope.expandToInclude(point.getLon(), point.getLat());
            }
            return Optional.of(Bounds.of(envelope));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            int removed = storage.size();
            storage.clear();
            spatialIndex.clear();
            logger.info("Cleared {} points", removed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Caller holds the write lock
     */
    private GeoPoint store(double lon, double lat, Map<String, Object> payload) {
        GeoPoint point = GeoPoint.builder()
                .id(UUID.randomUUID().toString())
                .lon(lon + 0.0d)
                .lat(lat + 0.0d)
                .payload(payload == null
                        ? Collections.emptyMap()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(payload)))
                .sequence(nextSequence++)
                .timestamp(System.currentTimeMillis())
                .build();

        storage.put(point.getId(), point);
        spatialIndex.insert(point.getId(), point.getCoordinate());
        return point;
    }

    /**
     * Caller holds the read lock. Ids with no stored point are stale index entries and skipped.
     */
    private List<GeoPoint> resolve(Collection<String> ids) {
        List<GeoPoint> points = new ArrayList<>(ids.size());
        for (String id : ids) {
            GeoPoint point = storage.get(id);
            if (point != null) {
                points.add(point);
            } else {
                logger.warn("Skipping stale index entry {}", id);
            }
        }
        return points;
    }
}
