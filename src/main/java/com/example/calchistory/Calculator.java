package com.example.calchistory;

/**
 * Integer calculator that records every successful operation in a {@link History}.
 */
public interface Calculator {

    /**
     * Rebinds the history that receives entries for subsequent operations.
     * Entries already recorded stay in the previous history.
     *
     * @param history the new target, never {@code null}
     */
    void setHistory(History history);

    History getHistory();

    int add(int a, int b);

    int subtract(int a, int b);

    int multiply(int a, int b);

    /**
     * Divides {@code a} by {@code b}, truncating toward zero.
     *
     * @param a dividend
     * @param b divisor
     * @return quotient of the integer division
     * @throws IllegalArgumentException when {@code b} is zero
     */
    int divide(int a, int b);
}
