package com.barthel.proforma.domain.model.inputs;

import lombok.Builder;
import lombok.With;

/**
 * @param equityInvestment   owners' contribution at year 0
 * @param debtAmount         term loan drawn at year 0
 * @param debtInterestRate   annual interest rate on the loan
 * @param debtTenorYears     amortization period of the loan
 * @param equityReturnTarget discount rate used for the equity NPV
 */
@Builder(toBuilder = true)
@With
public record ConsultingFinancing(
        double equityInvestment,
        double debtAmount,
        double debtInterestRate,
        int debtTenorYears,
        double equityReturnTarget) {
}
