package com.geoindex.model.result;

import com.geoindex.model.SearchResult;
import lombok.EqualsAndHashCode;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Matches as a set. The iteration order of {@link #getResults()} carries no meaning
 * and callers compare membership only.
 */
@EqualsAndHashCode(callSuper = true)
public final class UnorderedQueryResult extends QueryResult {

    public UnorderedQueryResult(List<SearchResult> results) {
        super(results);
    }

    @Override
    public boolean isOrdered() {
        return false;
    }

    /**
     * Matched coordinates as {@code [lon, lat]} pairs. Duplicate coordinates collapse.
     */
    public Set<List<Double>> coordinates() {
        return getResults().stream()
                .map(result -> List.of(result.getPoint().getLon(), result.getPoint().getLat()))
                .collect(Collectors.toSet());
    }
}
