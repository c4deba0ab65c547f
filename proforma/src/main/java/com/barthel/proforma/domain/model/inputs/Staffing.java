package com.barthel.proforma.domain.model.inputs;

import lombok.Builder;
import lombok.With;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Billable staff pyramid of a consulting firm.
 */
@Builder(toBuilder = true)
@With
public record Staffing(StaffLevel partners, StaffLevel managers, StaffLevel analysts) {

    public Staffing {
        Objects.requireNonNull(partners, "Partner level is required");
        Objects.requireNonNull(managers, "Manager level is required");
        Objects.requireNonNull(analysts, "Analyst level is required");
    }

    public List<StaffLevel> levels() {
        return List.of(partners, managers, analysts);
    }

    public int totalHeadcount() {
        return partners.headcount() + managers.headcount() + analysts.headcount();
    }

    Staffing map(UnaryOperator<StaffLevel> change) {
        return new Staffing(change.apply(partners), change.apply(managers), change.apply(analysts));
    }
}
