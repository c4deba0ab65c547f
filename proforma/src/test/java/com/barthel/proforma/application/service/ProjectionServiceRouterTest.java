package com.barthel.proforma.application.service;

import com.barthel.proforma.application.service.impl.ConsultingProjectionService;
import com.barthel.proforma.application.service.impl.SolarProjectionService;
import com.barthel.proforma.domain.model.Sector;
import com.barthel.proforma.domain.model.inputs.ConsultingInputs;
import com.barthel.proforma.domain.model.inputs.SolarInputs;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectionServiceRouterTest {

    private final ProjectionServiceRouter router = new ProjectionServiceRouter(
            List.of(new SolarProjectionService(), new ConsultingProjectionService()));

    @Test
    void routesBySectorOfTheInputs() {
        assertEquals(Sector.SOLAR, router.buildSchedule(SolarInputs.defaults()).schedule().sector());
        assertEquals(Sector.CONSULTING, router.buildSchedule(ConsultingInputs.defaults()).schedule().sector());
    }

    @Test
    void suppliesDefaultsPerSector() {
        assertInstanceOf(SolarInputs.class, router.defaultInputs(Sector.SOLAR));
        assertInstanceOf(ConsultingInputs.class, router.defaultInputs(Sector.CONSULTING));
    }

    @Test
    void failsForSectorWithoutService() {
        ProjectionServiceRouter solarOnly = new ProjectionServiceRouter(List.of(new SolarProjectionService()));

        assertThrows(UnsupportedOperationException.class, () -> solarOnly.buildSchedule(ConsultingInputs.defaults()));
        assertThrows(UnsupportedOperationException.class, () -> solarOnly.defaultInputs(Sector.CONSULTING));
    }
}
