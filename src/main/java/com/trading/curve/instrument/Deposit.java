package com.trading.curve.instrument;

/**
 * A money-market deposit quote.
 *
 * @param maturity Years to maturity.
 * @param rate     Quoted rate as a decimal.
 */
public record Deposit(double maturity, double rate) {
}
