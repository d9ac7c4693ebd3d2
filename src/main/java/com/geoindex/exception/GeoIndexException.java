package com.geoindex.exception;

import lombok.Getter;

/**
 * Base exception for every error the index reports to its caller
 */
@Getter
public class GeoIndexException extends RuntimeException {

    private final ErrorKind kind;

    public GeoIndexException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
