package com.trading.curve.bootstrap;

/**
 * Root-finder configuration for the bond bootstrapper.
 *
 * @param lowerBound           Lower rate of the first bracket.
 * @param upperBound           Upper rate of the first bracket.
 * @param maxIterations        Iteration cap for the first bracket.
 * @param widenedLowerBound    Lower rate of the retry bracket.
 * @param widenedUpperBound    Upper rate of the retry bracket.
 * @param widenedMaxIterations Iteration cap for the retry bracket.
 * @param rateTolerance        Absolute tolerance on the solved rate.
 * @param priceTolerance       Absolute tolerance on the repriced bond.
 */
public record SolverSettings(
        double lowerBound,
        double upperBound,
        int maxIterations,
        double widenedLowerBound,
        double widenedUpperBound,
        int widenedMaxIterations,
        double rateTolerance,
        double priceTolerance) {

    public SolverSettings {
        if (!(lowerBound < upperBound) || !(widenedLowerBound < widenedUpperBound))
            throw new IllegalArgumentException("Solver brackets must have lower < upper");
        if (maxIterations <= 0 || widenedMaxIterations <= 0)
            throw new IllegalArgumentException("Solver iteration caps must be positive");
        if (!(rateTolerance > 0) || !(priceTolerance > 0))
            throw new IllegalArgumentException("Solver tolerances must be positive");
    }

    /** [-5%, 50%] for 100 iterations, then [-10%, 100%] for 200. */
    public static SolverSettings defaults() {
        return new SolverSettings(-0.05, 0.5, 100, -0.10, 1.0, 200, 1e-12, 1e-10);
    }
}
