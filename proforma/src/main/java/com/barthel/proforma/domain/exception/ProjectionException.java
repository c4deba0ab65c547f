package com.barthel.proforma.domain.exception;

/**
 * Base type for failures of the projection engine that callers are expected to report.
 */
public abstract class ProjectionException extends RuntimeException {

    protected ProjectionException(String message) {
        super(message);
    }
}
