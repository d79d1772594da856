package com.example.calchistory;

/**
 * How {@link SimpleCalculator} treats results that do not fit in an {@code int}.
 */
public enum OverflowPolicy {
    /** Two's-complement wraparound, no error. */
    WRAP,
    /** Overflow raises {@link ArithmeticException} and nothing is recorded. */
    CHECKED
}
