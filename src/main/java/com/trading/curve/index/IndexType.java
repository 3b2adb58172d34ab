package com.trading.curve.index;

/**
 * Family of an interest-rate benchmark.
 */
public enum IndexType {
    /** Overnight index (SOFR, ESTR, SONIA). */
    OIS,
    /** Interbank offered rate (LIBOR, EURIBOR). */
    IBOR,
    TREASURY,
    SWAP
}
