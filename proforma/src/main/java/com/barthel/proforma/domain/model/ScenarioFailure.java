package com.barthel.proforma.domain.model;

import com.barthel.proforma.domain.exception.InvalidAssumptionException;
import com.barthel.proforma.domain.exception.NoConvergenceException;
import com.barthel.proforma.domain.exception.ProjectionException;

/**
 * Error marker recorded for a scenario that could not be computed.
 *
 * @param kind    what went wrong
 * @param field   offending input field, {@code null} when not tied to one
 * @param message human-readable detail
 */
public record ScenarioFailure(Kind kind, String field, String message) {

    public enum Kind {
        INVALID_ASSUMPTION,
        NO_CONVERGENCE
    }

    public static ScenarioFailure from(ProjectionException exception) {
        if (exception instanceof InvalidAssumptionException invalid) {
            return new ScenarioFailure(Kind.INVALID_ASSUMPTION, invalid.getField(), invalid.getMessage());
        }
        if (exception instanceof NoConvergenceException) {
            return new ScenarioFailure(Kind.NO_CONVERGENCE, null, exception.getMessage());
        }
        throw new IllegalArgumentException("Unknown projection failure: " + exception.getClass().getName());
    }
}
