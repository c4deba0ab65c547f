package com.barthel.proforma.application.service.impl;

import com.barthel.proforma.application.port.in.BuildProjectionUseCase;
import com.barthel.proforma.domain.exception.InvalidAssumptionException;
import com.barthel.proforma.domain.finance.DebtAmortizer;
import com.barthel.proforma.domain.model.*;
import com.barthel.proforma.domain.model.inputs.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Projection for a professional-services firm with constant headcount.
 * There is no depreciation; tax is a flat rate on earnings after interest.
 */
@Slf4j
@Service
public class ConsultingProjectionService implements BuildProjectionUseCase {

    static final double DAYS_PER_YEAR = 365.0;

    @Override
    public Projection buildSchedule(ProjectInputs inputs) {
        if (!(inputs instanceof ConsultingInputs firm)) {
            throw new IllegalArgumentException("Consulting projection requires consulting inputs, got " + inputs.sector());
        }
        int horizon = firm.forecastYears();
        if (horizon <= 0) {
            throw new InvalidAssumptionException("forecast_years", "must be at least one year, was " + horizon);
        }
        Staffing staffing = firm.staffing();
        if (staffing.totalHeadcount() <= 0) {
            throw new InvalidAssumptionException("headcount", "firm has no billable staff");
        }
        if (firm.billableHoursPerYear() <= 0.0) {
            throw new InvalidAssumptionException("billable_hours_per_year",
                    "must be positive, was " + firm.billableHoursPerYear());
        }

        FinancingStructure financing = financing(firm.financing(), horizon);
        WorkingCapital workingCapital = firm.workingCapital();
        double receivableDays = workingCapital.wipDays() + workingCapital.arDays();

        double billableHours = 0.0;
        double revenue = 0.0;
        double salaries = 0.0;
        for (StaffLevel level : staffing.levels()) {
            double hours = level.headcount() * firm.billableHoursPerYear() * level.utilization();
            billableHours += hours;
            revenue += hours * level.billingRate() * level.realization();
            salaries += level.headcount() * level.salary();
        }
        double operatingCost = salaries + firm.overhead().total();

        List<ForecastRow> rows = new ArrayList<>(horizon);
        double previousWorkingCapital = 0.0;
        for (int year = 1; year <= horizon; year++) {
            if (year > 1) {
                revenue *= 1.0 + firm.billingRateEscalator();
                operatingCost *= 1.0 + firm.costEscalator();
            }
            double retainer = revenue * firm.retainerFraction();
            double ebitda = revenue - operatingCost;

            double interest = financing.interestIn(year);
            double principal = financing.principalIn(year);
            double taxableIncome = ebitda - interest;
            // losses are not carried forward
            double tax = Math.max(taxableIncome, 0.0) * firm.corporateTaxRate();
            double netIncome = taxableIncome - tax;

            double netWorkingCapital = revenue * receivableDays / DAYS_PER_YEAR
                    - operatingCost * workingCapital.apDays() / DAYS_PER_YEAR;
            double workingCapitalChange = netWorkingCapital - previousWorkingCapital;
            previousWorkingCapital = netWorkingCapital;

            rows.add(ForecastRow.builder()
                    .year(year)
                    .output(billableHours)
                    .contractedRevenue(retainer)
                    .uncontractedRevenue(revenue - retainer)
                    .revenue(revenue)
                    .operatingCost(operatingCost)
                    .ebitda(ebitda)
                    .depreciation(0.0)
                    .interest(interest)
                    .principal(principal)
                    .debtService(interest + principal)
                    .taxableIncome(taxableIncome)
                    .tax(tax)
                    .netIncome(netIncome)
                    .workingCapitalChange(workingCapitalChange)
                    .netCashFlow(netIncome - workingCapitalChange - principal)
                    .build());
            log.debug("Consulting year {}: revenue={}, ebitda={}, working capital change={}",
                    year, revenue, ebitda, workingCapitalChange);
        }

        log.info("Built {}-year consulting schedule: headcount={}, year-1 revenue={}, equity={}",
                horizon, staffing.totalHeadcount(), rows.get(0).revenue(), financing.equityContribution());
        return new Projection(new ProjectionSchedule(Sector.CONSULTING, rows), financing);
    }

    @Override
    public ProjectInputs defaultInputs(Sector sector) {
        return ConsultingInputs.defaults();
    }

    @Override
    public boolean supports(Sector sector) {
        return sector == Sector.CONSULTING;
    }

    private static FinancingStructure financing(ConsultingFinancing terms, int horizon) {
        double debt = terms.debtAmount();
        if (debt < 0.0) {
            throw new InvalidAssumptionException("debt_amount", "must not be negative, was " + debt);
        }
        double rate = terms.debtInterestRate();
        int tenor = terms.debtTenorYears();
        return FinancingStructure.builder()
                .totalCapex(0.0)
                .itcAmount(0.0)
                .fundingRequirement(terms.equityInvestment() + debt)
                .debtPrincipal(debt)
                .equityContribution(terms.equityInvestment())
                .interestRate(rate)
                .tenorYears(tenor)
                .levelPayment(DebtAmortizer.levelPayment(debt, rate, tenor))
                .equityDiscountRate(terms.equityReturnTarget())
                .amortization(DebtAmortizer.amortize(debt, rate, tenor, horizon))
                .build();
    }
}
