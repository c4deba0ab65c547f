package com.barthel.proforma.application.port.in;

import com.barthel.proforma.domain.model.FinancingStructure;
import com.barthel.proforma.domain.model.ProjectMetrics;
import com.barthel.proforma.domain.model.Projection;
import com.barthel.proforma.domain.model.ProjectionSchedule;
import com.barthel.proforma.domain.model.SummaryTotals;

/**
 * Use case for reducing a projection to investor and lender metrics.
 */
public interface ComputeMetricsUseCase {
    /**
     * Internal rate of return of {@code -equity} at year 0 followed by each year's
     * net cash flow to equity.
     *
     * @param schedule  the yearly schedule
     * @param financing the capital stack of the schedule
     * @return the equity IRR as a fraction
     * @throws com.barthel.proforma.domain.exception.NoConvergenceException if no rate can be found
     */
    double equityIrr(ProjectionSchedule schedule, FinancingStructure financing);

    /**
     * Net present value of the equity cash flows.
     *
     * @param schedule     the yearly schedule
     * @param financing    the capital stack of the schedule
     * @param discountRate annual discount rate, greater than -1
     * @return the equity NPV
     */
    double equityNpv(ProjectionSchedule schedule, FinancingStructure financing, double discountRate);

    /**
     * Totals over the horizon.
     *
     * @param schedule the yearly schedule
     * @return the summed line items
     */
    SummaryTotals summary(ProjectionSchedule schedule);

    /**
     * All metrics of a projection.
     *
     * @param projection the projection to evaluate
     * @return the metrics
     */
    ProjectMetrics evaluate(Projection projection);
}
