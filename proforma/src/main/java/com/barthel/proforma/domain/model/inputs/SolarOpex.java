package com.barthel.proforma.domain.model.inputs;

import lombok.Builder;
import lombok.With;

/**
 * Operating cost assumptions.
 *
 * @param fixedOmPerKw     fixed O&M, $/kW AC per year
 * @param insuranceAnnual  flat annual insurance premium
 * @param landLeaseAnnual  flat annual land lease payment
 * @param opexEscalator    annual escalation applied to all operating costs
 */
@Builder(toBuilder = true)
@With
public record SolarOpex(
        double fixedOmPerKw,
        double insuranceAnnual,
        double landLeaseAnnual,
        double opexEscalator) {

    SolarOpex scaledBy(double multiplier) {
        return new SolarOpex(
                fixedOmPerKw * multiplier,
                insuranceAnnual * multiplier,
                landLeaseAnnual * multiplier,
                opexEscalator);
    }
}
