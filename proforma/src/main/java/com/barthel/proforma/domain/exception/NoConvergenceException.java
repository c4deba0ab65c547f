package com.barthel.proforma.domain.exception;

import java.util.Arrays;

/**
 * The IRR solver could not find a root for a cash-flow series.
 */
public class NoConvergenceException extends ProjectionException {

    private final double[] series;

    public NoConvergenceException(double[] series, String reason) {
        super("IRR did not converge (" + reason + ") for cash flows " + Arrays.toString(series));
        this.series = series.clone();
    }

    /**
     * @return a copy of the cash-flow series the solver was given
     */
    public double[] getSeries() {
        return series.clone();
    }
}
