package com.barthel.proforma.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Engine settings bound from {@code proforma.*}.
 *
 * @param irr       IRR solver settings
 * @param scenarios scenario runner settings
 */
@ConfigurationProperties(prefix = "proforma")
public record ProformaProperties(@DefaultValue Irr irr, @DefaultValue Scenarios scenarios) {

    /**
     * @param lowerBound    lowest rate searched
     * @param upperBound    highest rate searched
     * @param tolerance     convergence threshold on the rate step
     * @param maxIterations Newton iteration limit before bisection takes over
     * @param initialGuess  Newton starting rate
     */
    public record Irr(
            @DefaultValue("-0.99") double lowerBound,
            @DefaultValue("10.0") double upperBound,
            @DefaultValue("1e-10") double tolerance,
            @DefaultValue("100") int maxIterations,
            @DefaultValue("0.1") double initialGuess) {
    }

    /**
     * @param parallelism number of scenarios evaluated at the same time
     */
    public record Scenarios(@DefaultValue("4") int parallelism) {
        public Scenarios {
            if (parallelism < 1) {
                throw new IllegalArgumentException("Scenario parallelism must be at least 1");
            }
        }
    }
}
