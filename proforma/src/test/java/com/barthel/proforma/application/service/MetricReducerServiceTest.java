package com.barthel.proforma.application.service;

import com.barthel.proforma.application.service.impl.ConsultingProjectionService;
import com.barthel.proforma.application.service.impl.SolarProjectionService;
import com.barthel.proforma.domain.exception.InvalidAssumptionException;
import com.barthel.proforma.domain.exception.NoConvergenceException;
import com.barthel.proforma.domain.finance.IrrSolver;
import com.barthel.proforma.domain.model.*;
import com.barthel.proforma.domain.model.inputs.ConsultingInputs;
import com.barthel.proforma.domain.model.inputs.SolarInputs;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetricReducerServiceTest {

    private final MetricReducerService reducer = new MetricReducerService(IrrSolver.defaults());

    @Test
    void equityIrrStartsFromTheEquityOutlay() {
        ProjectionSchedule schedule = schedule(300.0, 300.0, 300.0, 300.0, 300.0);

        double irr = reducer.equityIrr(schedule, equity(1_000.0));

        assertEquals(IrrSolver.defaults().solve(new double[]{-1_000.0, 300.0, 300.0, 300.0, 300.0, 300.0}), irr);
        assertTrue(irr > 0.0);
    }

    @Test
    void equityIrrIsInvariantToScale() {
        double irr = reducer.equityIrr(schedule(120.0, 250.0, 400.0, 380.0), equity(800.0));
        double scaledIrr = reducer.equityIrr(schedule(1.2e6, 2.5e6, 4.0e6, 3.8e6), equity(8.0e6));

        assertEquals(irr, scaledIrr, 1e-9);
    }

    @Test
    void equityIrrFailsWithTheSeriesWhenThereIsNoReturn() {
        NoConvergenceException ex = assertThrows(NoConvergenceException.class,
                () -> reducer.equityIrr(schedule(-50.0, -20.0), equity(100.0)));

        assertArrayEquals(new double[]{-100.0, -50.0, -20.0}, ex.getSeries());
    }

    @Test
    void npvAtZeroIsTheUndiscountedSum() {
        assertEquals(500.0, reducer.equityNpv(schedule(300.0, 300.0, 300.0, 300.0, 300.0), equity(1_000.0), 0.0), 1e-9);
    }

    @Test
    void npvRejectsRatesAtOrBelowMinusOneHundredPercent() {
        assertThrows(InvalidAssumptionException.class,
                () -> reducer.equityNpv(schedule(100.0), equity(50.0), -1.0));
    }

    @Test
    void summaryAddsEveryYear() {
        ProjectionSchedule schedule = new SolarProjectionService().buildSchedule(SolarInputs.defaults()).schedule();

        SummaryTotals totals = reducer.summary(schedule);

        assertEquals(schedule.rows().stream().mapToDouble(ForecastRow::revenue).sum(), totals.totalRevenue(), 1e-3);
        assertEquals(schedule.rows().stream().mapToDouble(ForecastRow::ebitda).sum(), totals.totalEbitda(), 1e-3);
        assertEquals(schedule.rows().stream().mapToDouble(ForecastRow::netIncome).sum(), totals.totalNetIncome(), 1e-3);
        assertEquals(schedule.rows().stream().mapToDouble(ForecastRow::debtService).sum(), totals.totalDebtService(), 1e-3);
        assertEquals(totals.totalRevenue() - totals.totalOperatingCost(), totals.totalEbitda(), 1e-3);
    }

    @Test
    void defaultSolarProjectIsBankable() {
        Projection projection = new SolarProjectionService().buildSchedule(SolarInputs.defaults());

        ProjectMetrics metrics = reducer.evaluate(projection);

        assertTrue(metrics.equityIrr() > 0.0);
        assertNotNull(metrics.minimumDscr());
        assertTrue(metrics.minimumDscr() > 1.0);
        assertTrue(metrics.averageDscr() >= metrics.minimumDscr());
        assertTrue(metrics.equityMultiple() > 1.0);
        assertNotNull(metrics.paybackYear());
        assertEquals(reducer.equityNpv(projection.schedule(), projection.financing(), 0.12), metrics.equityNpv());
    }

    @Test
    void unleveredFirmHasNoCoverageRatio() {
        Projection projection = new ConsultingProjectionService().buildSchedule(ConsultingInputs.defaults());

        ProjectMetrics metrics = reducer.evaluate(projection);

        assertNull(metrics.minimumDscr());
        assertNull(metrics.averageDscr());
        assertTrue(metrics.equityIrr() > 0.0);
    }

    @Test
    void fullyDebtFundedProjectHasNoEquityReturn() {
        SolarInputs defaults = SolarInputs.defaults();
        SolarInputs allDebt = defaults.withFinancing(defaults.financing().withDebtFraction(1.0));
        Projection projection = new SolarProjectionService().buildSchedule(allDebt);

        ProjectMetrics metrics = reducer.evaluate(projection);

        assertEquals(0.0, projection.financing().equityContribution());
        assertNull(metrics.equityIrr());
        assertNull(metrics.equityMultiple());
        assertNotNull(metrics.minimumDscr());
        assertEquals(reducer.summary(projection.schedule()), metrics.summary());
    }

    @Test
    void paybackIsTheFirstYearCumulativeCashTurnsPositive() {
        ProjectMetrics metrics = reducer.evaluate(new Projection(schedule(400.0, 400.0, 400.0, 400.0), equity(1_000.0)));

        assertEquals(Integer.valueOf(3), metrics.paybackYear());
        assertEquals(1.6, metrics.equityMultiple(), 1e-12);
    }

    private static ProjectionSchedule schedule(double... cashFlows) {
        List<ForecastRow> rows = new ArrayList<>();
        for (int i = 0; i < cashFlows.length; i++) {
            rows.add(ForecastRow.builder()
                    .year(i + 1)
                    .revenue(cashFlows[i])
                    .ebitda(cashFlows[i])
                    .netIncome(cashFlows[i])
                    .netCashFlow(cashFlows[i])
                    .build());
        }
        return new ProjectionSchedule(Sector.SOLAR, rows);
    }

    private static FinancingStructure equity(double amount) {
        return FinancingStructure.builder()
                .fundingRequirement(amount)
                .equityContribution(amount)
                .equityDiscountRate(0.1)
                .build();
    }
}
