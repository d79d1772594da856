package com.example.calchistory;

/**
 * Binary operations supported by {@link Calculator}, with the symbol used in history entries.
 */
public enum Operation {
    ADD("+", "addition"),
    SUBTRACT("-", "subtraction"),
    MULTIPLY("*", "multiplication"),
    DIVIDE("/", "division");

    private final String symbol;
    private final String description;

    Operation(String symbol, String description) {
        this.symbol = symbol;
        this.description = description;
    }

    public String symbol() {
        return symbol;
    }

    public String description() {
        return description;
    }

    /**
     * Formats an entry as {@code "<a> <symbol> <b> = <result>"}.
     */
    public String format(int a, int b, int result) {
        return a + " " + symbol + " " + b + " = " + result;
    }
}
