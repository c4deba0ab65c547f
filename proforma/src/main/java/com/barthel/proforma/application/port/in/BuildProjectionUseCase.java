package com.barthel.proforma.application.port.in;

import com.barthel.proforma.domain.model.Projection;
import com.barthel.proforma.domain.model.Sector;
import com.barthel.proforma.domain.model.inputs.ProjectInputs;

/**
 * Use case for unrolling project inputs into a yearly schedule and its financing.
 */
public interface BuildProjectionUseCase {
    /**
     * Builds the projection for the given inputs.
     *
     * @param inputs validated project assumptions
     * @return the schedule and financing structure
     * @throws com.barthel.proforma.domain.exception.InvalidAssumptionException if an input cannot be computed with
     */
    Projection buildSchedule(ProjectInputs inputs);

    /**
     * Canonical example inputs for a sector.
     *
     * @param sector the sector
     * @return default inputs satisfying every documented field range
     */
    ProjectInputs defaultInputs(Sector sector);

    /**
     * Whether this implementation handles the given sector.
     *
     * @param sector the sector to check
     * @return true if supported
     */
    boolean supports(Sector sector);
}
