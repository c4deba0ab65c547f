package com.barthel.proforma.domain.model;

import lombok.Builder;

import java.util.List;

/**
 * Capital stack of one projection.
 *
 * @param totalCapex          construction cost including contingency, zero where the sector has none
 * @param itcAmount           investment tax credit taken as a basis reduction
 * @param fundingRequirement  amount funded with debt and equity at year 0
 * @param debtPrincipal       term loan drawn at year 0
 * @param equityContribution  equity invested at year 0
 * @param interestRate        annual interest rate on the loan
 * @param tenorYears          amortization period of the loan
 * @param levelPayment        annual annuity payment, zero without debt
 * @param equityDiscountRate  equity return target used for NPV
 * @param amortization        repayment entries for years 1..tenor
 */
@Builder
public record FinancingStructure(
        double totalCapex,
        double itcAmount,
        double fundingRequirement,
        double debtPrincipal,
        double equityContribution,
        double interestRate,
        int tenorYears,
        double levelPayment,
        double equityDiscountRate,
        List<AmortizationEntry> amortization) {

    public FinancingStructure {
        amortization = amortization == null ? List.of() : List.copyOf(amortization);
    }

    public double interestIn(int year) {
        return year >= 1 && year <= amortization.size() ? amortization.get(year - 1).interest() : 0.0;
    }

    public double principalIn(int year) {
        return year >= 1 && year <= amortization.size() ? amortization.get(year - 1).principal() : 0.0;
    }
}
