package com.trading.curve.index;

/**
 * How often an index is fixed.
 */
public enum FixingFrequency {
    DAILY,
    MONTHLY,
    QUARTERLY,
    SEMI_ANNUAL
}
