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
 * Projection for utility-scale solar PV. The ITC reduces the funded and
 * depreciable basis; it is not booked as a cash credit.
 */
@Slf4j
@Service
public class SolarProjectionService implements BuildProjectionUseCase {

    static final double HOURS_PER_YEAR = 8_760.0;
    private static final double KW_PER_MW = 1_000.0;
    /** Depreciable basis is reduced by half of the ITC. */
    private static final double ITC_BASIS_HAIRCUT = 0.5;

    @Override
    public Projection buildSchedule(ProjectInputs inputs) {
        if (!(inputs instanceof SolarInputs solar)) {
            throw new IllegalArgumentException("Solar projection requires solar inputs, got " + inputs.sector());
        }
        int horizon = solar.projectLifeYears();
        if (horizon <= 0) {
            throw new InvalidAssumptionException("project_life_years", "must be at least one year, was " + horizon);
        }

        CapitalCost cost = capitalCost(solar.capex(), solar.site(), solar.tax());
        FinancingStructure financing = financing(solar.financing(), cost, horizon);

        SolarSite site = solar.site();
        SolarRevenue revenue = solar.revenue();
        SolarOpex opex = solar.opex();
        MacrsClass macrs = solar.tax().macrsClass();
        double taxRate = solar.tax().corporateTaxRate();

        double energy = site.acMw() * site.capacityFactor() * HOURS_PER_YEAR * site.performanceRatio();
        double ppaPrice = revenue.ppaPrice();
        double merchantPrice = revenue.merchantPrice();
        double operatingCost = site.acMw() * KW_PER_MW * opex.fixedOmPerKw()
                + opex.insuranceAnnual() + opex.landLeaseAnnual();

        List<ForecastRow> rows = new ArrayList<>(horizon);
        for (int year = 1; year <= horizon; year++) {
            if (year > 1) {
                energy *= 1.0 - site.degradationRate();
                ppaPrice *= 1.0 + revenue.ppaEscalator();
                merchantPrice *= 1.0 + revenue.merchantEscalator();
                operatingCost *= 1.0 + opex.opexEscalator();
            }
            double ppaRevenue = energy * (1.0 - revenue.merchantFraction()) * ppaPrice;
            double merchantRevenue = energy * revenue.merchantFraction() * merchantPrice;
            double totalRevenue = ppaRevenue + merchantRevenue;
            double ebitda = totalRevenue - operatingCost;

            double interest = financing.interestIn(year);
            double principal = financing.principalIn(year);
            double depreciation = cost.depreciableBasis() * macrs.rate(year);
            double taxableIncome = ebitda - depreciation - interest;
            // losses are not carried forward
            double tax = Math.max(taxableIncome, 0.0) * taxRate;

            rows.add(ForecastRow.builder()
                    .year(year)
                    .output(energy)
                    .contractedRevenue(ppaRevenue)
                    .uncontractedRevenue(merchantRevenue)
                    .revenue(totalRevenue)
                    .operatingCost(operatingCost)
                    .ebitda(ebitda)
                    .depreciation(depreciation)
                    .interest(interest)
                    .principal(principal)
                    .debtService(interest + principal)
                    .taxableIncome(taxableIncome)
                    .tax(tax)
                    .netIncome(taxableIncome - tax)
                    .workingCapitalChange(0.0)
                    .netCashFlow(ebitda - interest - principal - tax)
                    .build());
            log.debug("Solar year {}: energy={} MWh, revenue={}, ebitda={}", year, energy, totalRevenue, ebitda);
        }

        log.info("Built {}-year solar schedule: total capex={}, ITC={}, debt={}, equity={}",
                horizon, cost.total(), cost.itc(), financing.debtPrincipal(), financing.equityContribution());
        return new Projection(new ProjectionSchedule(Sector.SOLAR, rows), financing);
    }

    @Override
    public ProjectInputs defaultInputs(Sector sector) {
        return SolarInputs.defaults();
    }

    @Override
    public boolean supports(Sector sector) {
        return sector == Sector.SOLAR;
    }

    private static CapitalCost capitalCost(SolarCapex capex, SolarSite site, SolarTax tax) {
        double perKw = capex.moduleCostPerKw() + capex.inverterCostPerKw() + capex.bosCostPerKw();
        double uplift = 1.0 + capex.contingencyFraction();
        double total = (site.dcMw() * KW_PER_MW * perKw
                + capex.interconnectCost() + capex.landCost() + capex.developmentCost()) * uplift;
        // land does not qualify for the ITC and is not depreciable
        double eligibleBasis = total - capex.landCost() * uplift;
        double itc = eligibleBasis * tax.itcFraction();
        return new CapitalCost(total, itc, total - itc, eligibleBasis - ITC_BASIS_HAIRCUT * itc);
    }

    private static FinancingStructure financing(SolarFinancing terms, CapitalCost cost, int horizon) {
        double debtFraction = terms.debtFraction();
        if (!(debtFraction >= 0.0 && debtFraction <= 1.0)) {
            throw new InvalidAssumptionException("debt_fraction", "must lie within [0, 1], was " + debtFraction);
        }
        double debt = cost.net() * debtFraction;
        double rate = terms.debtInterestRate();
        int tenor = terms.debtTenorYears();
        return FinancingStructure.builder()
                .totalCapex(cost.total())
                .itcAmount(cost.itc())
                .fundingRequirement(cost.net())
                .debtPrincipal(debt)
                .equityContribution(cost.net() - debt)
                .interestRate(rate)
                .tenorYears(tenor)
                .levelPayment(DebtAmortizer.levelPayment(debt, rate, tenor))
                .equityDiscountRate(terms.equityReturnTarget())
                .amortization(DebtAmortizer.amortize(debt, rate, tenor, horizon))
                .build();
    }

    private record CapitalCost(double total, double itc, double net, double depreciableBasis) {
    }
}
