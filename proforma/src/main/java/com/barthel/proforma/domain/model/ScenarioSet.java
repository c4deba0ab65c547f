package com.barthel.proforma.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Scenario results in the order the multipliers were given.
 *
 * @param sector  sector of the base inputs
 * @param field   the scaled input field
 * @param results one result per multiplier
 */
public record ScenarioSet(Sector sector, String field, List<ScenarioResult> results) {
    public ScenarioSet {
        Objects.requireNonNull(sector, "Sector is required");
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Scenario field must not be blank");
        }
        results = List.copyOf(results);
    }

    public long failureCount() {
        return results.stream().filter(r -> !r.isSuccess()).count();
    }
}
