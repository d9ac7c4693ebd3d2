package com.geoindex.model.result;

import com.geoindex.model.SearchResult;
import lombok.EqualsAndHashCode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Matches in ascending distance order, ties broken by insertion order. Distances are populated.
 */
@EqualsAndHashCode(callSuper = true)
public final class OrderedQueryResult extends QueryResult {

    public OrderedQueryResult(List<SearchResult> results) {
        super(results);
    }

    @Override
    public boolean isOrdered() {
        return true;
    }

    public SearchResult first() {
        return getResults().isEmpty() ? null : getResults().get(0);
    }

    /**
     * Matched coordinates as {@code [lon, lat]} pairs, in result order
     */
    public List<List<Double>> coordinates() {
        return getResults().stream()
                .map(result -> List.of(result.getPoint().getLon(), result.getPoint().getLat()))
                .collect(Collectors.toList());
    }

    public List<Double> distances() {
        return getResults().stream().map(SearchResult::getDistance).collect(Collectors.toList());
    }
}
