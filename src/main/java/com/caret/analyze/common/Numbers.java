package com.caret.analyze.common;

/**
 * Numeric helpers for formatting trace statistics.
 */
public final class Numbers {

    private static final double NS_TO_MS = 1.0e-6;

    private Numbers() {
        // utility class
    }

    /**
     * Number of decimal digits in the absolute value of {@code i}.
     */
    public static int numDigit(long i) {
        String digits = Long.toString(i);
        return i < 0 ? digits.length() - 1 : digits.length();
    }

    /**
     * Converts nanoseconds to milliseconds.
     */
    public static double nsToMs(double nanoseconds) {
        return nanoseconds * NS_TO_MS;
    }
}
