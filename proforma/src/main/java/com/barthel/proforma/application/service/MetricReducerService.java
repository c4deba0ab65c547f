package com.barthel.proforma.application.service;

import com.barthel.proforma.application.port.in.ComputeMetricsUseCase;
import com.barthel.proforma.domain.exception.InvalidAssumptionException;
import com.barthel.proforma.domain.finance.IrrSolver;
import com.barthel.proforma.domain.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reduces a projection to equity returns, coverage ratios and horizon totals.
 * The equity series is {@code -equityContribution} at year 0 followed by each
 * row's net cash flow.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricReducerService implements ComputeMetricsUseCase {

    private final IrrSolver irrSolver;

    @Override
    public double equityIrr(ProjectionSchedule schedule, FinancingStructure financing) {
        return irrSolver.solve(equityCashFlows(schedule, financing));
    }

    @Override
    public double equityNpv(ProjectionSchedule schedule, FinancingStructure financing, double discountRate) {
        if (!(discountRate > -1.0) || Double.isInfinite(discountRate)) {
            throw new InvalidAssumptionException("equity_return_target",
                    "discount rate must be a finite rate above -100%, was " + discountRate);
        }
        return IrrSolver.npv(discountRate, equityCashFlows(schedule, financing));
    }

    @Override
    public SummaryTotals summary(ProjectionSchedule schedule) {
        double output = 0.0;
        double revenue = 0.0;
        double operatingCost = 0.0;
        double ebitda = 0.0;
        double tax = 0.0;
        double netIncome = 0.0;
        double debtService = 0.0;
        double netCashFlow = 0.0;
        for (ForecastRow row : schedule.rows()) {
            output += row.output();
            revenue += row.revenue();
            operatingCost += row.operatingCost();
            ebitda += row.ebitda();
            tax += row.tax();
            netIncome += row.netIncome();
            debtService += row.debtService();
            netCashFlow += row.netCashFlow();
        }
        return SummaryTotals.builder()
                .totalOutput(output)
                .totalRevenue(revenue)
                .totalOperatingCost(operatingCost)
                .totalEbitda(ebitda)
                .totalTax(tax)
                .totalNetIncome(netIncome)
                .totalDebtService(debtService)
                .totalNetCashFlow(netCashFlow)
                .build();
    }

    @Override
    public ProjectMetrics evaluate(Projection projection) {
        ProjectionSchedule schedule = projection.schedule();
        FinancingStructure financing = projection.financing();

        SummaryTotals totals = summary(schedule);
        double equity = financing.equityContribution();
        // a fully debt-funded project has no outlay to earn a return on
        Double irr = equity > 0.0 ? equityIrr(schedule, financing) : null;
        double npv = equityNpv(schedule, financing, financing.equityDiscountRate());

        Double minimumDscr = null;
        double dscrSum = 0.0;
        int dscrYears = 0;
        for (ForecastRow row : schedule.rows()) {
            if (row.debtService() > 0.0) {
                // cash available for debt service, after tax and working capital
                double dscr = (row.netCashFlow() + row.debtService()) / row.debtService();
                minimumDscr = minimumDscr == null ? dscr : Math.min(minimumDscr, dscr);
                dscrSum += dscr;
                dscrYears++;
            }
        }

        Double equityMultiple = equity > 0.0 ? totals.totalNetCashFlow() / equity : null;

        log.info("Evaluated {} projection: equity IRR={}, NPV@{}={}, min DSCR={}",
                schedule.sector(), irr, financing.equityDiscountRate(), npv, minimumDscr);
        return ProjectMetrics.builder()
                .summary(totals)
                .equityIrr(irr)
                .equityNpv(npv)
                .minimumDscr(minimumDscr)
                .averageDscr(dscrYears > 0 ? dscrSum / dscrYears : null)
                .equityMultiple(equityMultiple)
                .paybackYear(paybackYear(schedule, equity))
                .build();
    }

    private static double[] equityCashFlows(ProjectionSchedule schedule, FinancingStructure financing) {
        double[] flows = new double[schedule.horizon() + 1];
        flows[0] = -financing.equityContribution();
        for (ForecastRow row : schedule.rows()) {
            flows[row.year()] = row.netCashFlow();
        }
        return flows;
    }

    private static Integer paybackYear(ProjectionSchedule schedule, double equity) {
        double cumulative = -equity;
        for (ForecastRow row : schedule.rows()) {
            cumulative += row.netCashFlow();
            if (cumulative >= 0.0) {
                return row.year();
            }
        }
        return null;
    }
}
