package com.barthel.proforma.domain.model.inputs;

import lombok.Builder;
import lombok.With;

/**
 * @param debtFraction       share of net capex funded with debt, 0..1
 * @param debtInterestRate   annual interest rate on the term loan
 * @param debtTenorYears     amortization period of the term loan
 * @param equityReturnTarget discount rate used for the equity NPV
 */
@Builder(toBuilder = true)
@With
public record SolarFinancing(
        double debtFraction,
        double debtInterestRate,
        int debtTenorYears,
        double equityReturnTarget) {
}
