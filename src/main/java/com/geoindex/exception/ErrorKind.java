package com.geoindex.exception;

/**
 * Distinguishable kinds of rejected input
 */
public enum ErrorKind {
    INVALID_COORDINATE,
    INVALID_PARAMETER,
    NOT_FOUND
}
