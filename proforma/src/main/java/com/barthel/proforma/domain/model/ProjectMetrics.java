package com.barthel.proforma.domain.model;

import lombok.Builder;

import java.util.Objects;

/**
 * Investor and lender metrics of one projection.
 *
 * @param summary        horizon totals
 * @param equityIrr      internal rate of return of the equity cash flows, {@code null} without equity
 * @param equityNpv      equity NPV at the equity return target
 * @param minimumDscr    lowest debt service coverage ratio, {@code null} without debt service
 * @param averageDscr    mean debt service coverage ratio, {@code null} without debt service
 * @param equityMultiple total equity inflows over the contribution, {@code null} without equity
 * @param paybackYear    first year cumulative equity cash turns non-negative, {@code null} if never
 */
@Builder
public record ProjectMetrics(
        SummaryTotals summary,
        Double equityIrr,
        double equityNpv,
        Double minimumDscr,
        Double averageDscr,
        Double equityMultiple,
        Integer paybackYear) {

    public ProjectMetrics {
        Objects.requireNonNull(summary, "Summary totals are required");
    }
}
