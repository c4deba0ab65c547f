package com.barthel.proforma.domain.model;

import lombok.Builder;

/**
 * Projected figures for one operating year.
 *
 * @param year                 1-based year after financial close
 * @param output               energy in MWh (solar) or billable hours (consulting)
 * @param contractedRevenue    PPA (solar) or retainer (consulting) revenue
 * @param uncontractedRevenue  merchant (solar) or project (consulting) revenue
 * @param revenue              total revenue
 * @param operatingCost        total operating cost
 * @param ebitda               revenue less operating cost
 * @param depreciation         tax depreciation
 * @param interest             interest paid on debt
 * @param principal            debt principal repaid
 * @param debtService          interest plus principal
 * @param taxableIncome        EBITDA less depreciation and interest
 * @param tax                  income tax, never negative
 * @param netIncome            taxable income less tax
 * @param workingCapitalChange increase in net working capital
 * @param netCashFlow          cash flow to equity
 */
@Builder
public record ForecastRow(
        int year,
        double output,
        double contractedRevenue,
        double uncontractedRevenue,
        double revenue,
        double operatingCost,
        double ebitda,
        double depreciation,
        double interest,
        double principal,
        double debtService,
        double taxableIncome,
        double tax,
        double netIncome,
        double workingCapitalChange,
        double netCashFlow) {

    public ForecastRow {
        if (year < 1) {
            throw new IllegalArgumentException("Forecast year must be at least 1");
        }
    }
}
