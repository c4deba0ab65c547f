package com.barthel.proforma.domain.model.inputs;

import com.barthel.proforma.domain.exception.InvalidAssumptionException;
import com.barthel.proforma.domain.model.Sector;
import lombok.Builder;
import lombok.With;

import java.util.Objects;
import java.util.Set;

/**
 * Assumptions for a professional-services firm. Staffing levels are held
 * constant over the horizon; rates and costs escalate annually.
 *
 * @param staffing              billable staff by level
 * @param billableHoursPerYear  standard available hours per person per year
 * @param retainerFraction      share of revenue billed as retainers, the rest is project work
 * @param overhead              non-billable costs
 * @param workingCapital        WIP, receivable and payable day counts
 * @param financing             equity and optional term loan
 * @param billingRateEscalator  annual compounding growth of billing rates
 * @param costEscalator         annual compounding growth of salaries and overhead
 * @param corporateTaxRate      flat income tax rate, 0..1
 * @param forecastYears         operating years to project
 */
@Builder(toBuilder = true)
@With
public record ConsultingInputs(
        Staffing staffing,
        double billableHoursPerYear,
        double retainerFraction,
        Overhead overhead,
        WorkingCapital workingCapital,
        ConsultingFinancing financing,
        double billingRateEscalator,
        double costEscalator,
        double corporateTaxRate,
        int forecastYears) implements ProjectInputs {

    /** 40 hours a week for 52 weeks. */
    public static final double STANDARD_BILLABLE_HOURS = 52 * 40;

    public static final String UTILIZATION = "utilization";
    public static final String REALIZATION = "realization";
    public static final String BILLING_RATE = "billing_rate";
    public static final String SALARY = "salary";
    public static final String OVERHEAD = "overhead";

    private static final Set<String> SCENARIO_FIELDS = Set.of(
            UTILIZATION, REALIZATION, BILLING_RATE, SALARY, OVERHEAD);

    public ConsultingInputs {
        Objects.requireNonNull(staffing, "Staffing is required");
        Objects.requireNonNull(overhead, "Overhead is required");
        Objects.requireNonNull(workingCapital, "Working capital assumptions are required");
        Objects.requireNonNull(financing, "Financing assumptions are required");
    }

    @Override
    public Sector sector() {
        return Sector.CONSULTING;
    }

    @Override
    public int horizonYears() {
        return forecastYears;
    }

    @Override
    public Set<String> scenarioFields() {
        return SCENARIO_FIELDS;
    }

    @Override
    public ConsultingInputs scaled(String field, double multiplier) {
        return switch (field) {
            case UTILIZATION -> withStaffing(staffing.map(l -> l.withUtilization(l.utilization() * multiplier)));
            case REALIZATION -> withStaffing(staffing.map(l -> l.withRealization(l.realization() * multiplier)));
            case BILLING_RATE -> withStaffing(staffing.map(l -> l.withBillingRate(l.billingRate() * multiplier)));
            case SALARY -> withStaffing(staffing.map(l -> l.withSalary(l.salary() * multiplier)));
            case OVERHEAD -> withOverhead(overhead.scaledBy(multiplier));
            default -> throw new InvalidAssumptionException(field, "not a scenario field for consulting inputs");
        };
    }

    /**
     * Reference 21-person firm used for demonstrations and smoke checks.
     *
     * @return the default consulting inputs
     */
    public static ConsultingInputs defaults() {
        return ConsultingInputs.builder()
                .staffing(Staffing.builder()
                        .partners(new StaffLevel(3, 350.0, 250_000.0, 0.6, 0.9))
                        .managers(new StaffLevel(6, 250.0, 150_000.0, 0.7, 0.9))
                        .analysts(new StaffLevel(12, 150.0, 90_000.0, 0.8, 0.85))
                        .build())
                .billableHoursPerYear(STANDARD_BILLABLE_HOURS)
                .retainerFraction(0.6)
                .overhead(Overhead.builder()
                        .rent(300_000.0)
                        .software(100_000.0)
                        .marketing(200_000.0)
                        .travel(150_000.0)
                        .adminSalaries(400_000.0)
                        .build())
                .workingCapital(new WorkingCapital(30.0, 45.0, 15.0))
                .financing(ConsultingFinancing.builder()
                        .equityInvestment(1_000_000.0)
                        .debtAmount(0.0)
                        .debtInterestRate(0.0)
                        .debtTenorYears(0)
                        .equityReturnTarget(0.15)
                        .build())
                .billingRateEscalator(0.03)
                .costEscalator(0.03)
                .corporateTaxRate(0.26)
                .forecastYears(5)
                .build();
    }
}
