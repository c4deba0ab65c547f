package com.barthel.proforma.domain.model.inputs;

import lombok.Builder;
import lombok.With;

/**
 * One seniority level of billable staff.
 *
 * @param headcount   number of people at this level
 * @param billingRate year-1 hourly billing rate
 * @param salary      year-1 annual salary per person
 * @param utilization share of available hours billed, 0..1
 * @param realization share of billed value collected, 0..1
 */
@Builder(toBuilder = true)
@With
public record StaffLevel(
        int headcount,
        double billingRate,
        double salary,
        double utilization,
        double realization) {
}
