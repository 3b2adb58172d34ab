package com.trading.curve.instrument;

/**
 * A fixed-coupon bullet bond quote.
 *
 * @param maturity  Years to maturity.
 * @param coupon    Annual coupon rate as a decimal (0 for a zero-coupon bond).
 * @param price     Market price per {@code faceValue}.
 * @param frequency Coupon payments per year.
 * @param faceValue Redemption amount.
 */
public record Bond(double maturity, double coupon, double price, int frequency, double faceValue) {
    public static final int DEFAULT_FREQUENCY = 2;
    public static final double DEFAULT_FACE_VALUE = 100.0;

    /** Semi-annual bond with a face value of 100. */
    public static Bond of(double maturity, double coupon, double price) {
        return new Bond(maturity, coupon, price, DEFAULT_FREQUENCY, DEFAULT_FACE_VALUE);
    }

    public static Bond zeroCoupon(double maturity, double price) {
        return of(maturity, 0.0, price);
    }

    public boolean isZeroCoupon() {
        return coupon == 0.0;
    }
}
