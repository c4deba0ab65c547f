package com.barthel.proforma.application.service;

import com.barthel.proforma.application.port.in.BuildProjectionUseCase;
import com.barthel.proforma.application.port.in.ComputeMetricsUseCase;
import com.barthel.proforma.application.port.in.RunScenariosUseCase;
import com.barthel.proforma.domain.exception.InvalidAssumptionException;
import com.barthel.proforma.domain.exception.ProjectionException;
import com.barthel.proforma.domain.model.*;
import com.barthel.proforma.domain.model.inputs.ProjectInputs;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs each scenario independently on the scenario executor and collects the
 * results in multiplier order.
 */
@Slf4j
@Service
public class ScenarioRunnerService implements RunScenariosUseCase {

    private final BuildProjectionUseCase buildProjectionUseCase;
    private final ComputeMetricsUseCase computeMetricsUseCase;
    private final Executor scenarioExecutor;

    public ScenarioRunnerService(BuildProjectionUseCase buildProjectionUseCase,
                                 ComputeMetricsUseCase computeMetricsUseCase,
                                 @Qualifier("scenarioExecutor") Executor scenarioExecutor) {
        this.buildProjectionUseCase = buildProjectionUseCase;
        this.computeMetricsUseCase = computeMetricsUseCase;
        this.scenarioExecutor = scenarioExecutor;
    }

    @Override
    public ScenarioSet runScenarios(ProjectInputs inputs, String field, List<Double> multipliers) {
        Objects.requireNonNull(inputs, "Inputs are required");
        Objects.requireNonNull(field, "Scenario field is required");
        Objects.requireNonNull(multipliers, "Multipliers are required");
        if (!inputs.scenarioFields().contains(field)) {
            throw new InvalidAssumptionException(field, "not a scenario field for "
                    + inputs.sector() + " inputs, expected one of " + new TreeSet<>(inputs.scenarioFields()));
        }
        multipliers.forEach(m -> Objects.requireNonNull(m, "Multipliers must not contain null"));

        log.info("Running {} {} scenarios on '{}'", multipliers.size(), inputs.sector(), field);
        List<CompletableFuture<ScenarioResult>> pending = multipliers.stream()
                .map(m -> CompletableFuture.supplyAsync(() -> runScenario(inputs, field, m), scenarioExecutor))
                .toList();
        List<ScenarioResult> results = pending.stream()
                .map(ScenarioRunnerService::await)
                .toList();

        ScenarioSet set = new ScenarioSet(inputs.sector(), field, results);
        if (set.failureCount() > 0) {
            log.warn("{} of {} scenarios on '{}' failed", set.failureCount(), results.size(), field);
        }
        return set;
    }

    private ScenarioResult runScenario(ProjectInputs inputs, String field, double multiplier) {
        try {
            if (!Double.isFinite(multiplier) || multiplier < 0.0) {
                throw new InvalidAssumptionException(field,
                        "multiplier must be finite and non-negative, was " + multiplier);
            }
            Projection projection = buildProjectionUseCase.buildSchedule(inputs.scaled(field, multiplier));
            return ScenarioResult.succeeded(multiplier, computeMetricsUseCase.evaluate(projection));
        } catch (ProjectionException e) {
            log.warn("Scenario {} x{} failed: {}", field, multiplier, e.getMessage());
            return ScenarioResult.failed(multiplier, ScenarioFailure.from(e));
        }
    }

    private static ScenarioResult await(CompletableFuture<ScenarioResult> scenario) {
        try {
            return scenario.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
