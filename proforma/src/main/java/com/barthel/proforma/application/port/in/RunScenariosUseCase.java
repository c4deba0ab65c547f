package com.barthel.proforma.application.port.in;

import com.barthel.proforma.domain.model.ScenarioSet;
import com.barthel.proforma.domain.model.inputs.ProjectInputs;

import java.util.List;

/**
 * Use case for sensitivity runs over one scaled input field.
 */
public interface RunScenariosUseCase {
    /**
     * Re-runs the projection once per multiplier. A failing scenario is recorded
     * in its own result and does not stop the others.
     *
     * @param inputs      base assumptions
     * @param field       name of the field to scale, see {@link ProjectInputs#scenarioFields()}
     * @param multipliers factors to apply, in output order
     * @return one result per multiplier
     * @throws com.barthel.proforma.domain.exception.InvalidAssumptionException if the field is unknown
     */
    ScenarioSet runScenarios(ProjectInputs inputs, String field, List<Double> multipliers);
}
