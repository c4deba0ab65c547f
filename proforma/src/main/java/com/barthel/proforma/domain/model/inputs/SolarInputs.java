package com.barthel.proforma.domain.model.inputs;

import com.barthel.proforma.domain.exception.InvalidAssumptionException;
import com.barthel.proforma.domain.model.Sector;
import lombok.Builder;
import lombok.With;

import java.util.Objects;
import java.util.Set;

/**
 * Assumptions for a utility-scale solar PV project.
 *
 * @param site             plant size and resource
 * @param capex            construction costs
 * @param opex             operating costs
 * @param revenue          PPA and merchant offtake
 * @param financing        term loan and equity target
 * @param tax              income tax, ITC and depreciation
 * @param projectLifeYears operating years to project
 */
@Builder(toBuilder = true)
@With
public record SolarInputs(
        SolarSite site,
        SolarCapex capex,
        SolarOpex opex,
        SolarRevenue revenue,
        SolarFinancing financing,
        SolarTax tax,
        int projectLifeYears) implements ProjectInputs {

    public static final String PPA_PRICE = "ppa_price";
    public static final String MERCHANT_PRICE = "merchant_price";
    public static final String CAPACITY_FACTOR = "capacity_factor";
    public static final String DEGRADATION = "degradation";
    public static final String CAPEX = "capex";
    public static final String OPEX = "opex";
    public static final String DEBT_INTEREST_RATE = "debt_interest_rate";

    private static final Set<String> SCENARIO_FIELDS = Set.of(
            PPA_PRICE, MERCHANT_PRICE, CAPACITY_FACTOR, DEGRADATION, CAPEX, OPEX, DEBT_INTEREST_RATE);

    public SolarInputs {
        Objects.requireNonNull(site, "Site assumptions are required");
        Objects.requireNonNull(capex, "Capex assumptions are required");
        Objects.requireNonNull(opex, "Opex assumptions are required");
        Objects.requireNonNull(revenue, "Revenue assumptions are required");
        Objects.requireNonNull(financing, "Financing assumptions are required");
        Objects.requireNonNull(tax, "Tax assumptions are required");
    }

    @Override
    public Sector sector() {
        return Sector.SOLAR;
    }

    @Override
    public int horizonYears() {
        return projectLifeYears;
    }

    @Override
    public Set<String> scenarioFields() {
        return SCENARIO_FIELDS;
    }

    @Override
    public SolarInputs scaled(String field, double multiplier) {
        return switch (field) {
            case PPA_PRICE -> withRevenue(revenue.withPpaPrice(revenue.ppaPrice() * multiplier));
            case MERCHANT_PRICE -> withRevenue(revenue.withMerchantPrice(revenue.merchantPrice() * multiplier));
            case CAPACITY_FACTOR -> withSite(site.withCapacityFactor(site.capacityFactor() * multiplier));
            case DEGRADATION -> withSite(site.withDegradationRate(site.degradationRate() * multiplier));
            case CAPEX -> withCapex(capex.scaledBy(multiplier));
            case OPEX -> withOpex(opex.scaledBy(multiplier));
            case DEBT_INTEREST_RATE -> withFinancing(
                    financing.withDebtInterestRate(financing.debtInterestRate() * multiplier));
            default -> throw new InvalidAssumptionException(field, "not a scenario field for solar inputs");
        };
    }

    /**
     * Reference 100 MW project used for demonstrations and smoke checks.
     *
     * @return the default solar inputs
     */
    public static SolarInputs defaults() {
        return SolarInputs.builder()
                .site(SolarSite.builder()
                        .acMw(100.0)
                        .dcMw(130.0)
                        .capacityFactor(0.25)
                        .performanceRatio(1.0)
                        .degradationRate(0.005)
                        .build())
                .capex(SolarCapex.builder()
                        .moduleCostPerKw(350.0)
                        .inverterCostPerKw(60.0)
                        .bosCostPerKw(200.0)
                        .interconnectCost(5_000_000.0)
                        .landCost(1_500_000.0)
                        .developmentCost(3_000_000.0)
                        .contingencyFraction(0.08)
                        .build())
                .opex(SolarOpex.builder()
                        .fixedOmPerKw(23.0)
                        .insuranceAnnual(200_000.0)
                        .landLeaseAnnual(150_000.0)
                        .opexEscalator(0.02)
                        .build())
                .revenue(SolarRevenue.builder()
                        .ppaPrice(45.0)
                        .ppaEscalator(0.02)
                        .merchantFraction(0.1)
                        .merchantPrice(40.0)
                        .merchantEscalator(0.0)
                        .build())
                .financing(SolarFinancing.builder()
                        .debtFraction(0.6)
                        .debtInterestRate(0.05)
                        .debtTenorYears(18)
                        .equityReturnTarget(0.12)
                        .build())
                .tax(SolarTax.builder()
                        .corporateTaxRate(0.26)
                        .itcFraction(0.30)
                        .macrsClass(MacrsClass.MACRS_5)
                        .build())
                .projectLifeYears(25)
                .build();
    }
}
