package com.barthel.proforma.domain.exception;

import lombok.Getter;

/**
 * An input that is well formed but cannot be computed with, e.g. a zero debt
 * tenor while debt is drawn.
 */
@Getter
public class InvalidAssumptionException extends ProjectionException {

    private final String field;
    private final String reason;

    public InvalidAssumptionException(String field, String reason) {
        super("Invalid assumption '" + field + "': " + reason);
        this.field = field;
        this.reason = reason;
    }
}
