package com.barthel.proforma.domain.finance;

import com.barthel.proforma.domain.exception.NoConvergenceException;

import java.util.OptionalDouble;

/**
 * Internal rate of return by Newton's method, falling back to bisection over a
 * bounded rate range when Newton diverges, leaves the range or stalls.
 * Cash flow {@code i} is discounted by {@code (1 + rate)^i}.
 */
public final class IrrSolver {

    public static final double DEFAULT_LOWER_BOUND = -0.99;
    public static final double DEFAULT_UPPER_BOUND = 10.0;
    public static final double DEFAULT_TOLERANCE = 1e-10;
    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_INITIAL_GUESS = 0.1;

    /** Sub-intervals scanned when looking for a sign change to bisect. */
    private static final int BRACKET_STEPS = 1_000;
    private static final int BISECTION_ITERATIONS = 200;

    private final double lowerBound;
    private final double upperBound;
    private final double tolerance;
    private final int maxIterations;
    private final double initialGuess;

    public IrrSolver(double lowerBound, double upperBound, double tolerance, int maxIterations, double initialGuess) {
        if (lowerBound <= -1.0 || lowerBound >= upperBound) {
            throw new IllegalArgumentException("IRR bounds must satisfy -1 < lower < upper, got ["
                    + lowerBound + ", " + upperBound + "]");
        }
        if (tolerance <= 0.0 || maxIterations <= 0) {
            throw new IllegalArgumentException("Tolerance and iteration limit must be positive");
        }
        if (initialGuess < lowerBound || initialGuess > upperBound) {
            throw new IllegalArgumentException("Initial guess " + initialGuess + " lies outside the IRR bounds");
        }
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
        this.initialGuess = initialGuess;
    }

    public static IrrSolver defaults() {
        return new IrrSolver(DEFAULT_LOWER_BOUND, DEFAULT_UPPER_BOUND, DEFAULT_TOLERANCE,
                DEFAULT_MAX_ITERATIONS, DEFAULT_INITIAL_GUESS);
    }

    /**
     * Solves for the rate at which the NPV of {@code cashFlows} is zero.
     *
     * @param cashFlows flows for periods 0..n
     * @return the internal rate of return
     * @throws NoConvergenceException if the flows never change sign or no root lies in range
     */
    public double solve(double[] cashFlows) {
        if (!changesSign(cashFlows)) {
            throw new NoConvergenceException(cashFlows, "cash flows never change sign");
        }
        OptionalDouble newton = newton(cashFlows);
        if (newton.isPresent()) {
            return newton.getAsDouble();
        }
        return bisect(cashFlows);
    }

    public static double npv(double rate, double[] cashFlows) {
        double discount = 1.0 + rate;
        double value = 0.0;
        for (int t = 0; t < cashFlows.length; t++) {
            value += cashFlows[t] / Math.pow(discount, t);
        }
        return value;
    }

    private static double npvDerivative(double rate, double[] cashFlows) {
        double discount = 1.0 + rate;
        double value = 0.0;
        for (int t = 1; t < cashFlows.length; t++) {
            value -= t * cashFlows[t] / Math.pow(discount, t + 1);
        }
        return value;
    }

    private static boolean changesSign(double[] cashFlows) {
        boolean positive = false;
        boolean negative = false;
        for (double flow : cashFlows) {
            positive |= flow > 0.0;
            negative |= flow < 0.0;
        }
        return positive && negative;
    }

    private OptionalDouble newton(double[] cashFlows) {
        double rate = initialGuess;
        for (int i = 0; i < maxIterations; i++) {
            double value = npv(rate, cashFlows);
            double slope = npvDerivative(rate, cashFlows);
            if (!Double.isFinite(value) || !Double.isFinite(slope) || slope == 0.0) {
                return OptionalDouble.empty();
            }
            double next = rate - value / slope;
            if (!Double.isFinite(next) || next < lowerBound || next > upperBound) {
                return OptionalDouble.empty();
            }
            if (Math.abs(next - rate) < tolerance) {
                return OptionalDouble.of(next);
            }
            rate = next;
        }
        return OptionalDouble.empty();
    }

    private double bisect(double[] cashFlows) {
        double step = (upperBound - lowerBound) / BRACKET_STEPS;
        double low = lowerBound;
        double lowValue = npv(low, cashFlows);
        for (int i = 1; i <= BRACKET_STEPS; i++) {
            if (lowValue == 0.0) {
                return low;
            }
            double high = i == BRACKET_STEPS ? upperBound : lowerBound + i * step;
            double highValue = npv(high, cashFlows);
            if (Double.isFinite(lowValue) && Double.isFinite(highValue)
                    && Math.signum(lowValue) != Math.signum(highValue)) {
                return bisect(cashFlows, low, high, lowValue);
            }
            low = high;
            lowValue = highValue;
        }
        if (lowValue == 0.0) {
            return low;
        }
        throw new NoConvergenceException(cashFlows,
                "no root between " + lowerBound + " and " + upperBound);
    }

    private double bisect(double[] cashFlows, double low, double high, double lowValue) {
        for (int i = 0; i < BISECTION_ITERATIONS; i++) {
            double mid = (low + high) / 2.0;
            double midValue = npv(mid, cashFlows);
            if (midValue == 0.0 || (high - low) / 2.0 < tolerance) {
                return mid;
            }
            if (Math.signum(midValue) == Math.signum(lowValue)) {
                low = mid;
                lowValue = midValue;
            } else {
                high = mid;
            }
        }
        return (low + high) / 2.0;
    }
}
