package com.geoindex.engine;

import com.geoindex.distance.DistanceModel;
import com.geoindex.distance.PlanarDistanceModel;
import com.geoindex.distance.SphericalDistanceModel;
import com.geoindex.model.GeoPoint;
import com.geoindex.model.SearchResult;
import com.geoindex.model.query.ExactQuery;
import com.geoindex.model.query.GeoQuery;
import com.geoindex.model.query.NearQuery;
import com.geoindex.model.query.WithinRadiusQuery;
import com.geoindex.model.result.OrderedQueryResult;
import com.geoindex.model.result.QueryResult;
import com.geoindex.model.result.UnorderedQueryResult;
import com.geoindex.repository.GeoPointRepository;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Evaluates typed queries against a store.
 * <p>
 * Holds no state between queries. Candidate lookup goes through the store's spatial
 * index in one read, then candidates are scored and filtered with the distance model
 * the query selects.
 */
@Slf4j
@Component
public class QueryEngine {

    private static final Comparator<SearchResult> BY_DISTANCE_THEN_INSERTION =
            Comparator.comparingDouble(SearchResult::getDistance)
                      .thenComparingLong(result -> result.getPoint().getSequence());

    private final PlanarDistanceModel planar;
    private final SphericalDistanceModel spherical;

    public QueryEngine(PlanarDistanceModel planar, SphericalDistanceModel spherical) {
        this.planar = planar;
        this.spherical = spherical;
    }

    public QueryResult execute(GeoQuery query, GeoPointRepository repository) {
        switch (query.getType()) {
            case EXACT:
                return exact((ExactQuery) query, repository);
            case NEAR:
                return near((NearQuery) query, repository);
            case WITHIN_RADIUS:
                return withinRadius((WithinRadiusQuery) query, repository);
            default:
                throw new IllegalStateException("Unsupported query type: " + query.getType());
        }
    }

    public UnorderedQueryResult exact(ExactQuery query, GeoPointRepository repository) {
        List<SearchResult> results = new ArrayList<>();
        for (GeoPoint point : repository.findAt(query.getLon(), query.getLat())) {
            results.add(SearchResult.builder().point(point).build());
        }
        log.debug("Exact query at ({}, {}) matched {} points", query.getLon(), query.getLat(), results.size());
        return new UnorderedQueryResult(results);
    }

    public OrderedQueryResult near(NearQuery query, GeoPointRepository repository) {
        DistanceModel model = modelFor(query.isSpherical());
        Coordinate origin = query.getOrigin();

        List<GeoPoint> candidates = query.hasMaxDistance()
                ? repository.findCandidatesNear(origin, query.getMaxDistance(), model)
                : repository.findAll();

        List<SearchResult> results = new ArrayList<>(candidates.size());
        for (GeoPoint point : candidates) {
            double distance = model.distance(origin, point.getCoordinate());
            if (!query.hasMaxDistance() || distance <= query.getMaxDistance()) {
                results.add(SearchResult.builder().point(point).distance(distance).build());
            }
        }
        results.sort(BY_DISTANCE_THEN_INSERTION);

        if (query.hasLimit() && results.size() > query.getLimit()) {
            results = new ArrayList<>(results.subList(0, query.getLimit()));
        }

        log.debug("Near query from ({}, {}) scored {} candidates, returning {} ({} model)",
                query.getLon(), query.getLat(), candidates.size(), results.size(), model.unit());
        return new OrderedQueryResult(results);
    }

    public UnorderedQueryResult withinRadius(WithinRadiusQuery query, GeoPointRepository repository) {
        DistanceModel model = modelFor(query.isSpherical());
        Coordinate origin = query.getOrigin();

        List<GeoPoint> candidates = repository.findCandidatesNear(origin, query.getRadius(), model);

        List<SearchResult> results = new ArrayList<>();
        for (GeoPoint point : candidates) {
            if (model.distance(origin, point.getCoordinate()) <= query.getRadius()) {
                results.add(SearchResult.builder().point(point).build());
            }
        }

        log.debug("Within-radius query around ({}, {}) scored {} candidates, matched {} ({} model)",
                query.getLon(), query.getLat(), candidates.size(), results.size(), model.unit());
        return new UnorderedQueryResult(results);
    }

    DistanceModel modelFor(boolean sphericalQuery) {
        return sphericalQuery ? spherical : planar;
    }
}
