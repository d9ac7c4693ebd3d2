package com.geoindex.service.impl;

import com.geoindex.aspect.Timed;
import com.geoindex.engine.QueryEngine;
import com.geoindex.exception.PointNotFoundException;
import com.geoindex.model.Bounds;
import com.geoindex.model.GeoPoint;
import com.geoindex.model.NewPoint;
import com.geoindex.model.query.GeoQuery;
import com.geoindex.model.result.QueryResult;
import com.geoindex.repository.GeoPointRepository;
import com.geoindex.service.GeoIndexService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Implementation of GeoIndexService over a single point store
 */
@Service
public class GeoIndexServiceImpl implements GeoIndexService {

    private static final Logger logger = LoggerFactory.getLogger(GeoIndexServiceImpl.class);

    @Autowired
    private GeoPointRepository geoPointRepository;

    @Autowired
    private QueryEngine queryEngine;

    @Override
    public String insert(double lon, double lat, Map<String, Object> payload) {
        return geoPointRepository.insert(lon, lat, payload).getId();
    }

    @Override
    @Timed(value = "bulk insert", logLevel = Timed.LogLevel.INFO)
    public List<GeoPoint> bulkInsert(List<NewPoint> points) {
        return geoPointRepository.bulkInsert(points);
    }

    @Override
    public void remove(String id) {
        geoPointRepository.remove(id);
    }

    @Override
    public GeoPoint get(String id) {
        return geoPointRepository.get(id).orElseThrow(() -> new PointNotFoundException(id));
    }

    @Override
    public Optional<GeoPoint> find(String id) {
        return geoPointRepository.get(id);
    }

    @Override
    @Timed("query")
    public QueryResult query(GeoQuery query) {
        logger.debug("Executing {}", query);
        return queryEngine.execute(query, geoPointRepository);
    }

    @Override
    public long count() {
        return geoPointRepository.count();
    }

    @Override
    public Optional<Bounds> bounds() {
        return geoPointRepository.bounds();
    }

    @Override
    public void clear() {
        geoPointRepository.clear();
        logger.info("Store cleared");
    }
}
