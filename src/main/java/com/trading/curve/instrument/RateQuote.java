package com.trading.curve.instrument;

/**
 * A (tenor, rate) observation not yet tied to an index.
 */
public record RateQuote(double tenor, double rate) {

    /** Tags this quote with the index it was observed on. */
    public IndexObservation forIndex(String indexCode) {
        return new IndexObservation(indexCode, tenor, rate);
    }
}
