package com.trading.curve.api;

/**
 * Observability hook for the bootstrapping process.
 *
 * <p>
 * Callbacks run inline on the bootstrapping thread and should stay cheap.
 */
public interface BootstrapListener {

    /** Listener that ignores every callback. */
    BootstrapListener NONE = new BootstrapListener() {
    };

    /**
     * Called once a point has been solved.
     *
     * @param index      Position of the instrument in maturity order.
     * @param tenor      The solved tenor.
     * @param rate       The solved spot rate.
     * @param iterations Root-finder iterations used; 0 for closed-form solves.
     */
    default void onPointSolved(int index, double tenor, double rate, int iterations) {
    }

    /**
     * Called when the default bracket failed and the solver retries with the
     * widened bracket.
     */
    default void onBracketWidened(int index, double tenor) {
    }
}
