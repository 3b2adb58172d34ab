package com.trading.curve.api;

import java.util.List;

/**
 * Derives spot-rate points from raw market instruments.
 *
 * @param <T> Instrument type consumed by this bootstrapper.
 */
public interface Bootstrapper<T> {
    /** The instrument type accepted by {@link #bootstrap(List)}. */
    Class<T> instrumentType();

    /**
     * Builds (tenor, spot rate) points sorted by tenor.
     *
     * @throws com.trading.curve.exception.CurveValidationException if the list
     *                                                              is empty or
     *                                                              an instrument
     *                                                              is invalid.
     */
    CurvePoints bootstrap(List<? extends T> instruments);
}
