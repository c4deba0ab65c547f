package com.barthel.proforma.domain.model;

import lombok.Builder;

/**
 * Sums over every operating year of a schedule.
 */
@Builder
public record SummaryTotals(
        double totalOutput,
        double totalRevenue,
        double totalOperatingCost,
        double totalEbitda,
        double totalTax,
        double totalNetIncome,
        double totalDebtService,
        double totalNetCashFlow) {
}
