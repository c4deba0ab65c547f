package com.barthel.proforma.domain.model;

import java.util.Objects;

/**
 * Output of a projection build: the yearly schedule and the capital stack behind it.
 */
public record Projection(ProjectionSchedule schedule, FinancingStructure financing) {
    public Projection {
        Objects.requireNonNull(schedule, "Schedule is required");
        Objects.requireNonNull(financing, "Financing structure is required");
    }
}
