package com.barthel.proforma.application.service.impl;

import com.barthel.proforma.domain.exception.InvalidAssumptionException;
import com.barthel.proforma.domain.model.*;
import com.barthel.proforma.domain.model.inputs.ConsultingInputs;
import com.barthel.proforma.domain.model.inputs.SolarInputs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Solar projection")
class SolarProjectionServiceTest {

    private final SolarProjectionService service = new SolarProjectionService();
    private final SolarInputs defaults = SolarInputs.defaults();

    @Test
    void buildsOneRowPerProjectYear() {
        ProjectionSchedule schedule = service.buildSchedule(defaults).schedule();

        assertEquals(Sector.SOLAR, schedule.sector());
        assertEquals(25, schedule.horizon());
        assertEquals(1, schedule.row(1).year());
        assertEquals(25, schedule.row(25).year());
    }

    @Test
    void firstYearEnergyFollowsCapacityAndResource() {
        ForecastRow first = service.buildSchedule(defaults).schedule().row(1);

        assertEquals(100.0 * 0.25 * 8_760.0, first.output(), 1e-6);
        assertEquals(219_000.0 * 0.9 * 45.0, first.contractedRevenue(), 1e-6);
        assertEquals(219_000.0 * 0.1 * 40.0, first.uncontractedRevenue(), 1e-6);
    }

    @Test
    void energyDegradesByTheConfiguredRateEachYear() {
        ProjectionSchedule schedule = service.buildSchedule(defaults).schedule();

        for (int year = 2; year <= schedule.horizon(); year++) {
            double expected = schedule.row(year - 1).output() * (1.0 - 0.005);
            assertEquals(expected, schedule.row(year).output(), 1e-9, "year " + year);
        }
        assertEquals(schedule.row(1).output() * Math.pow(0.995, 24), schedule.row(25).output(), 1e-6);
    }

    @Test
    void ppaPriceCompoundsWhileMerchantStaysFlat() {
        ProjectionSchedule schedule = service.buildSchedule(defaults).schedule();
        ForecastRow first = schedule.row(1);
        ForecastRow tenth = schedule.row(10);

        double ppaPrice = tenth.contractedRevenue() / (tenth.output() * 0.9);
        double merchantPrice = tenth.uncontractedRevenue() / (tenth.output() * 0.1);
        assertEquals(45.0 * Math.pow(1.02, 9), ppaPrice, 1e-9);
        assertEquals(40.0, merchantPrice, 1e-9);
        assertEquals(first.operatingCost() * Math.pow(1.02, 9), tenth.operatingCost(), 1e-6);
    }

    @Test
    void itcReducesTheFundedBasis() {
        FinancingStructure financing = service.buildSchedule(defaults).financing();

        double total = (130_000.0 * 610.0 + 5_000_000.0 + 1_500_000.0 + 3_000_000.0) * 1.08;
        double itc = (total - 1_500_000.0 * 1.08) * 0.30;
        assertEquals(total, financing.totalCapex(), 1e-4);
        assertEquals(itc, financing.itcAmount(), 1e-4);
        assertEquals(total - itc, financing.fundingRequirement(), 1e-4);
        assertEquals((total - itc) * 0.6, financing.debtPrincipal(), 1e-4);
        assertEquals(financing.fundingRequirement(),
                financing.debtPrincipal() + financing.equityContribution(), 1e-6);
    }

    @Test
    void debtIsRetiredByTheEndOfTheTenor() {
        Projection projection = service.buildSchedule(defaults);
        ProjectionSchedule schedule = projection.schedule();

        double repaid = schedule.rows().stream().mapToDouble(ForecastRow::principal).sum();
        assertEquals(projection.financing().debtPrincipal(), repaid, 1e-4);
        assertTrue(schedule.row(18).debtService() > 0.0);
        for (int year = 19; year <= 25; year++) {
            assertEquals(0.0, schedule.row(year).debtService(), "year " + year);
        }
    }

    @Test
    void depreciationStopsWhenTheMacrsTableIsExhausted() {
        ProjectionSchedule schedule = service.buildSchedule(defaults).schedule();

        assertTrue(schedule.row(6).depreciation() > 0.0);
        assertEquals(0.0, schedule.row(7).depreciation());
        assertEquals(schedule.row(2).depreciation() / 0.32 * 0.20, schedule.row(1).depreciation(), 1e-6);
    }

    @Test
    void negativeTaxableIncomePaysNoTax() {
        ForecastRow first = service.buildSchedule(defaults).schedule().row(1);

        assertTrue(first.taxableIncome() < 0.0);
        assertEquals(0.0, first.tax());
        assertEquals(first.taxableIncome(), first.netIncome(), 1e-9);
    }

    @Test
    void cashFlowToEquityIsEbitdaLessDebtServiceAndTax() {
        for (ForecastRow row : service.buildSchedule(defaults).schedule().rows()) {
            assertEquals(row.ebitda() - row.debtService() - row.tax(), row.netCashFlow(), 1e-6);
            assertEquals(Math.max(row.taxableIncome(), 0.0) * 0.26, row.tax(), 1e-6);
        }
    }

    @Test
    void buildingTwiceGivesIdenticalProjections() {
        assertEquals(service.buildSchedule(defaults), service.buildSchedule(SolarInputs.defaults()));
    }

    @Test
    void allEquityProjectHasNoDebtService() {
        SolarInputs unlevered = defaults.withFinancing(defaults.financing().withDebtFraction(0.0).withDebtTenorYears(0));

        Projection projection = service.buildSchedule(unlevered);

        assertTrue(projection.financing().amortization().isEmpty());
        assertEquals(projection.financing().fundingRequirement(), projection.financing().equityContribution());
        projection.schedule().rows().forEach(row -> assertEquals(0.0, row.debtService()));
    }

    @Test
    void nearZeroInterestRateKeepsCashFlowsFinite() {
        Projection projection = service.buildSchedule(defaults.scaled("debt_interest_rate", 1e-16));

        double repaid = projection.financing().amortization().stream()
                .mapToDouble(AmortizationEntry::principal).sum();
        assertEquals(projection.financing().debtPrincipal(), repaid, 1e-4);
        projection.schedule().rows().forEach(row ->
                assertTrue(Double.isFinite(row.netCashFlow()), "year " + row.year()));
    }

    @Test
    void zeroTenorWithDebtIsAnInvalidAssumption() {
        SolarInputs malformed = defaults.withFinancing(defaults.financing().withDebtTenorYears(0));

        InvalidAssumptionException ex = assertThrows(InvalidAssumptionException.class,
                () -> service.buildSchedule(malformed));

        assertEquals("debt_tenor_years", ex.getField());
    }

    @Test
    void debtFractionOutsideUnitIntervalIsAnInvalidAssumption() {
        SolarInputs malformed = defaults.withFinancing(defaults.financing().withDebtFraction(1.2));

        assertEquals("debt_fraction",
                assertThrows(InvalidAssumptionException.class, () -> service.buildSchedule(malformed)).getField());
    }

    @Test
    void nonPositiveProjectLifeIsAnInvalidAssumption() {
        assertEquals("project_life_years",
                assertThrows(InvalidAssumptionException.class,
                        () -> service.buildSchedule(defaults.withProjectLifeYears(0))).getField());
    }

    @Test
    void rejectsInputsOfAnotherSector() {
        assertThrows(IllegalArgumentException.class, () -> service.buildSchedule(ConsultingInputs.defaults()));
        assertTrue(service.supports(Sector.SOLAR));
        assertFalse(service.supports(Sector.CONSULTING));
    }
}
