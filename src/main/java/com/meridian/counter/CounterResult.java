package com.meridian.counter;

/**
 * Outcome of a conditional counter increment.
 *
 * @param applied whether the delta was added
 * @param value   counter value after the operation (unchanged when not applied)
 */
public record CounterResult(boolean applied, double value) {

    /**
     * Tolerance for floating point sums of currency amounts.
     */
    public static final double EPSILON = 1e-9;

    public static CounterResult applied(double value) {
        return new CounterResult(true, value);
    }

    public static CounterResult rejected(double value) {
        return new CounterResult(false, value);
    }
}
