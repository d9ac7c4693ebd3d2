package com.geoindex.model.query;

/**
 * The closed set of query shapes the engine evaluates
 */
public enum QueryType {
    EXACT,
    NEAR,
    WITHIN_RADIUS
}
