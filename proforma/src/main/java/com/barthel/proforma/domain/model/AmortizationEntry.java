package com.barthel.proforma.domain.model;

/**
 * One year of a term loan's repayment schedule.
 */
public record AmortizationEntry(
        int year,
        double openingBalance,
        double interest,
        double principal,
        double closingBalance) {

    public double debtService() {
        return interest + principal;
    }
}
