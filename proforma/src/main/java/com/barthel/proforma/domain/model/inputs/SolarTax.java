package com.barthel.proforma.domain.model.inputs;

import lombok.Builder;
import lombok.With;

import java.util.Objects;

/**
 * @param corporateTaxRate combined income tax rate, 0..1
 * @param itcFraction      investment tax credit as a share of eligible basis, 0..1
 * @param macrsClass       depreciation recovery class
 */
@Builder(toBuilder = true)
@With
public record SolarTax(double corporateTaxRate, double itcFraction, MacrsClass macrsClass) {
    public SolarTax {
        Objects.requireNonNull(macrsClass, "MACRS class is required");
    }
}
