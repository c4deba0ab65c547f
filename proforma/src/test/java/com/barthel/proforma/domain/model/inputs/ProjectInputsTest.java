package com.barthel.proforma.domain.model.inputs;

import com.barthel.proforma.domain.exception.InvalidAssumptionException;
import com.barthel.proforma.domain.model.Sector;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProjectInputsTest {

    @Test
    void defaultsReportTheirSector() {
        assertEquals(Sector.SOLAR, SolarInputs.defaults().sector());
        assertEquals(Sector.CONSULTING, ConsultingInputs.defaults().sector());
        assertEquals(25, SolarInputs.defaults().horizonYears());
        assertEquals(5, ConsultingInputs.defaults().horizonYears());
    }

    @Test
    void scalingReturnsANewRecord() {
        SolarInputs base = SolarInputs.defaults();

        SolarInputs scaled = base.scaled(SolarInputs.PPA_PRICE, 1.1);

        assertEquals(45.0, base.revenue().ppaPrice());
        assertEquals(49.5, scaled.revenue().ppaPrice(), 1e-12);
        assertEquals(base.site(), scaled.site());
    }

    @Test
    void scalingByOneKeepsTheInputsEqual() {
        for (String field : SolarInputs.defaults().scenarioFields()) {
            assertEquals(SolarInputs.defaults(), SolarInputs.defaults().scaled(field, 1.0), field);
        }
        for (String field : ConsultingInputs.defaults().scenarioFields()) {
            assertEquals(ConsultingInputs.defaults(), ConsultingInputs.defaults().scaled(field, 1.0), field);
        }
    }

    @Test
    void capexScalingLeavesContingencyAlone() {
        SolarCapex capex = SolarInputs.defaults().scaled(SolarInputs.CAPEX, 2.0).capex();

        assertEquals(700.0, capex.moduleCostPerKw());
        assertEquals(10_000_000.0, capex.interconnectCost());
        assertEquals(0.08, capex.contingencyFraction());
    }

    @Test
    void utilizationScalesEveryStaffLevel() {
        Staffing staffing = ConsultingInputs.defaults().scaled(ConsultingInputs.UTILIZATION, 0.5).staffing();

        assertEquals(0.3, staffing.partners().utilization(), 1e-12);
        assertEquals(0.35, staffing.managers().utilization(), 1e-12);
        assertEquals(0.4, staffing.analysts().utilization(), 1e-12);
        assertEquals(350.0, staffing.partners().billingRate());
    }

    @Test
    void unknownFieldIsRejected() {
        InvalidAssumptionException ex = assertThrows(InvalidAssumptionException.class,
                () -> SolarInputs.defaults().scaled("utilization", 1.1));

        assertEquals("utilization", ex.getField());
    }
}
