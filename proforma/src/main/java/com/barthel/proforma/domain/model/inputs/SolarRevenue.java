package com.barthel.proforma.domain.model.inputs;

import lombok.Builder;
import lombok.With;

/**
 * Offtake assumptions. Energy not sold under the PPA is sold merchant.
 *
 * @param ppaPrice           year-1 contracted price, $/MWh
 * @param ppaEscalator       annual compounding PPA escalation
 * @param merchantFraction   share of energy sold merchant, 0..1
 * @param merchantPrice      year-1 merchant price, $/MWh
 * @param merchantEscalator  annual compounding merchant escalation, zero keeps it flat
 */
@Builder(toBuilder = true)
@With
public record SolarRevenue(
        double ppaPrice,
        double ppaEscalator,
        double merchantFraction,
        double merchantPrice,
        double merchantEscalator) {
}
