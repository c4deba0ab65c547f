package com.barthel.proforma.application.service;

import com.barthel.proforma.application.port.in.BuildProjectionUseCase;
import com.barthel.proforma.domain.model.Projection;
import com.barthel.proforma.domain.model.Sector;
import com.barthel.proforma.domain.model.inputs.ProjectInputs;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Facade routing requests to the projection service of the inputs' sector.
 */
@Service
@RequiredArgsConstructor
@Primary
public class ProjectionServiceRouter implements BuildProjectionUseCase {

    private final List<BuildProjectionUseCase> implementations;

    @Override
    public Projection buildSchedule(ProjectInputs inputs) {
        return route(inputs.sector()).buildSchedule(inputs);
    }

    @Override
    public ProjectInputs defaultInputs(Sector sector) {
        return route(sector).defaultInputs(sector);
    }

    @Override
    public boolean supports(Sector sector) {
        // Never called directly
        return false;
    }

    private BuildProjectionUseCase route(Sector sector) {
        return implementations.stream()
                .filter(i -> i.supports(sector))
                .findFirst()
                .orElseThrow(() -> new UnsupportedOperationException("No projection service for sector: " + sector));
    }
}
