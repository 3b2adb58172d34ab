package com.trading.curve.index;

/**
 * Static description of an interest-rate benchmark and its market
 * conventions.
 *
 * @param code            Registry key, e.g. {@code SOFR} or {@code EURIBOR-3M}.
 * @param name            Full name.
 * @param currency        ISO currency code.
 * @param indexType       Benchmark family.
 * @param dayCount        Default day-count convention name.
 * @param compounding     Default compounding method name.
 * @param fixingFrequency How often the index fixes.
 * @param description     Free text.
 */
public record InterestRateIndex(
        String code,
        String name,
        String currency,
        IndexType indexType,
        String dayCount,
        String compounding,
        FixingFrequency fixingFrequency,
        String description) {

    @Override
    public String toString() {
        return code + " (" + currency + ")";
    }
}
