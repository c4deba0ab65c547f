package com.barthel.proforma.domain.model.inputs;

import lombok.Builder;
import lombok.With;

/**
 * Construction cost assumptions. Per-kW costs apply to DC capacity.
 *
 * @param moduleCostPerKw     module cost, $/kW DC
 * @param inverterCostPerKw   inverter cost, $/kW DC
 * @param bosCostPerKw        balance of system cost, $/kW DC
 * @param interconnectCost    lump sum interconnection cost
 * @param landCost            lump sum land acquisition cost
 * @param developmentCost     lump sum development cost
 * @param contingencyFraction uplift applied to the sum of all items
 */
@Builder(toBuilder = true)
@With
public record SolarCapex(
        double moduleCostPerKw,
        double inverterCostPerKw,
        double bosCostPerKw,
        double interconnectCost,
        double landCost,
        double developmentCost,
        double contingencyFraction) {

    SolarCapex scaledBy(double multiplier) {
        return new SolarCapex(
                moduleCostPerKw * multiplier,
                inverterCostPerKw * multiplier,
                bosCostPerKw * multiplier,
                interconnectCost * multiplier,
                landCost * multiplier,
                developmentCost * multiplier,
                contingencyFraction);
    }
}
