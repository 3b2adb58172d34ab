package com.trading.curve.instrument;

/**
 * A rate observed on a named benchmark index, e.g. SOFR at 3 months.
 *
 * @param index Index code as registered in the
 *              {@link com.trading.curve.index.IndexRegistry}.
 * @param tenor Years.
 * @param rate  Decimal rate.
 */
public record IndexObservation(String index, double tenor, double rate) {
}
