package com.trading.curve.util;

import com.trading.curve.api.BootstrapListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A listener that aggregates root-finder statistics over one or more
 * bootstrap runs.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Points:</b> total solved, and how many used the closed form.</li>
 * <li><b>Iterations:</b> total and worst case per point.</li>
 * <li><b>Retries:</b> number of widened-bracket retries.</li>
 * </ul>
 *
 * <p>
 * Not thread-safe; attach one instance per bootstrapping thread.
 */
public final class SolverStatsListener implements BootstrapListener {
    private static final Logger log = LogManager.getLogger(SolverStatsListener.class);

    private int pointsSolved, closedFormSolves, widenedBrackets;
    private long totalIterations;
    private int maxIterations;

    @Override
    public void onPointSolved(int index, double tenor, double rate, int iterations) {
        pointsSolved++;
        if (iterations == 0)
            closedFormSolves++;
        totalIterations += iterations;
        if (iterations > maxIterations)
            maxIterations = iterations;
    }

    @Override
    public void onBracketWidened(int index, double tenor) {
        widenedBrackets++;
    }

    public int pointsSolved() {
        return pointsSolved;
    }

    public int closedFormSolves() {
        return closedFormSolves;
    }

    public int widenedBrackets() {
        return widenedBrackets;
    }

    public long totalIterations() {
        return totalIterations;
    }

    public int maxIterations() {
        return maxIterations;
    }

    public double avgIterations() {
        int iterative = pointsSolved - closedFormSolves;
        return iterative == 0 ? 0.0 : (double) totalIterations / iterative;
    }

    public void reset() {
        pointsSolved = closedFormSolves = widenedBrackets = maxIterations = 0;
        totalIterations = 0;
    }

    public void logSummary() {
        log.info(String.format("Bootstrap stats: %d points (%d closed form), avg %.1f / max %d iterations, %d widened",
                pointsSolved, closedFormSolves, avgIterations(), maxIterations, widenedBrackets));
    }
}
