package com.barthel.proforma.domain.model.inputs;

import lombok.Builder;
import lombok.With;

/**
 * Working capital day counts.
 *
 * @param wipDays days of revenue held as unbilled work in progress
 * @param arDays  days of revenue held as receivables
 * @param apDays  days of cost held as payables
 */
@Builder(toBuilder = true)
@With
public record WorkingCapital(double wipDays, double arDays, double apDays) {
}
