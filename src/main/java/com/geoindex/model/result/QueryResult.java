package com.geoindex.model.result;

import com.geoindex.model.GeoPoint;
import com.geoindex.model.SearchResult;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of a query. Whether the sequence carries a meaningful order is part of the
 * type: see {@link OrderedQueryResult} and {@link UnorderedQueryResult}.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class QueryResult {

    private final List<SearchResult> results;

    protected QueryResult(List<SearchResult> results) {
        this.results = Collections.unmodifiableList(results);
    }

    public abstract boolean isOrdered();

    public int size() {
        return results.size();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public List<GeoPoint> points() {
        return results.stream().map(SearchResult::getPoint).collect(Collectors.toList());
    }

    public boolean contains(String id) {
        return results.stream().anyMatch(result -> result.getId().equals(id));
    }
}
