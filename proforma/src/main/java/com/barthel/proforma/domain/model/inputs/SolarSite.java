package com.barthel.proforma.domain.model.inputs;

import lombok.Builder;
import lombok.With;

/**
 * Plant size and resource assumptions.
 *
 * @param acMw              nameplate AC capacity in MW
 * @param dcMw              installed DC capacity in MW
 * @param capacityFactor    net AC capacity factor, 0..1
 * @param performanceRatio  additional derate on the capacity factor, 0..1
 * @param degradationRate   annual compounding output loss, 0..1
 */
@Builder(toBuilder = true)
@With
public record SolarSite(
        double acMw,
        double dcMw,
        double capacityFactor,
        double performanceRatio,
        double degradationRate) {
}
