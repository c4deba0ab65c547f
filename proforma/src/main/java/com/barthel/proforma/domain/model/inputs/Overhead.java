package com.barthel.proforma.domain.model.inputs;

import lombok.Builder;
import lombok.With;

/**
 * Annual non-billable costs of a consulting firm, in year-1 dollars.
 */
@Builder(toBuilder = true)
@With
public record Overhead(
        double rent,
        double software,
        double marketing,
        double travel,
        double adminSalaries) {

    public double total() {
        return rent + software + marketing + travel + adminSalaries;
    }

    Overhead scaledBy(double multiplier) {
        return new Overhead(
                rent * multiplier,
                software * multiplier,
                marketing * multiplier,
                travel * multiplier,
                adminSalaries * multiplier);
    }

    public static Overhead none() {
        return new Overhead(0.0, 0.0, 0.0, 0.0, 0.0);
    }
}
