package com.barthel.proforma.domain.model;

/**
 * Outcome of one scenario: exactly one of {@code metrics} and {@code failure} is set.
 *
 * @param multiplier the factor applied to the scenario field
 * @param metrics    resulting metrics when the run succeeded
 * @param failure    error marker when it did not
 */
public record ScenarioResult(double multiplier, ProjectMetrics metrics, ScenarioFailure failure) {
    public ScenarioResult {
        if ((metrics == null) == (failure == null)) {
            throw new IllegalArgumentException("A scenario result holds either metrics or a failure");
        }
    }

    public static ScenarioResult succeeded(double multiplier, ProjectMetrics metrics) {
        return new ScenarioResult(multiplier, metrics, null);
    }

    public static ScenarioResult failed(double multiplier, ScenarioFailure failure) {
        return new ScenarioResult(multiplier, null, failure);
    }

    public boolean isSuccess() {
        return metrics != null;
    }
}
