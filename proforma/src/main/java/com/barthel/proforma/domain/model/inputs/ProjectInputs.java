package com.barthel.proforma.domain.model.inputs;

import com.barthel.proforma.domain.model.Sector;

import java.util.Set;

/**
 * Immutable set of assumptions for one project. A new sector is added as a new
 * permitted variant together with a projection service supporting it.
 */
public sealed interface ProjectInputs permits SolarInputs, ConsultingInputs {

    /**
     * @return the sector these inputs describe
     */
    Sector sector();

    /**
     * @return number of operating years to project
     */
    int horizonYears();

    /**
     * Names of the fields that {@link #scaled(String, double)} accepts.
     *
     * @return the scalable field names
     */
    Set<String> scenarioFields();

    /**
     * Returns a copy with the named field multiplied by the given factor.
     *
     * @param field      one of {@link #scenarioFields()}
     * @param multiplier the factor to apply
     * @return the scaled copy
     * @throws com.barthel.proforma.domain.exception.InvalidAssumptionException if the field is unknown
     */
    ProjectInputs scaled(String field, double multiplier);
}
