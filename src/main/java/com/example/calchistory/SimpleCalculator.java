package com.example.calchistory;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Calculator} over {@code int} that logs each successful operation to its bound history.
 * Not thread-safe.
 */
public final class SimpleCalculator implements Calculator {
    private static final Logger log = LoggerFactory.getLogger(SimpleCalculator.class);

    private final OverflowPolicy overflowPolicy;
    private History history;

    /**
     * Creates a calculator that wraps on overflow.
     *
     * @param history target for operation entries
     */
    public SimpleCalculator(History history) {
        this(history, OverflowPolicy.WRAP);
    }

    public SimpleCalculator(History history, OverflowPolicy overflowPolicy) {
        this.history = Objects.requireNonNull(history, "history");
        this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy");
    }

    @Override
    public void setHistory(History history) {
        this.history = Objects.requireNonNull(history, "history");
        log.debug("History rebound to {}", history.getClass().getSimpleName());
    }

    @Override
    public History getHistory() {
        return history;
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    @Override
    public int add(int a, int b) {
        int result;
        if (overflowPolicy == OverflowPolicy.CHECKED) {
            result = checked(Operation.ADD, a, b, () -> Math.addExact(a, b));
        } else {
            result = a + b;
        }
        return logOperation(Operation.ADD, a, b, result);
    }

    @Override
    public int subtract(int a, int b) {
        int result;
        if (overflowPolicy == OverflowPolicy.CHECKED) {
            result = checked(Operation.SUBTRACT, a, b, () -> Math.subtractExact(a, b));
        } else {
            result = a - b;
        }
        return logOperation(Operation.SUBTRACT, a, b, result);
    }

    @Override
    public int multiply(int a, int b) {
        int result;
        if (overflowPolicy == OverflowPolicy.CHECKED) {
            result = checked(Operation.MULTIPLY, a, b, () -> Math.multiplyExact(a, b));
        } else {
            result = a * b;
        }
        return logOperation(Operation.MULTIPLY, a, b, result);
    }

    @Override
    public int divide(int a, int b) {
        if (b == 0) {
            log.warn("Rejected division of {} by zero", a);
            throw new IllegalArgumentException("Division by zero");
        }
        // MIN_VALUE / -1 is the only quotient that does not fit
        if (overflowPolicy == OverflowPolicy.CHECKED && a == Integer.MIN_VALUE && b == -1) {
            throw overflow(Operation.DIVIDE, a, b);
        }
        return logOperation(Operation.DIVIDE, a, b, a / b);
    }

    private int checked(Operation operation, int a, int b, ExactOperation exact) {
        try {
            return exact.apply();
        } catch (ArithmeticException e) {
            throw overflow(operation, a, b);
        }
    }

    private ArithmeticException overflow(Operation operation, int a, int b) {
        log.warn("Integer overflow in {} of {} and {}", operation.description(), a, b);
        return new ArithmeticException("Integer overflow in " + operation.description());
    }

    private int logOperation(Operation operation, int a, int b, int result) {
        String entry = operation.format(a, b, result);
        history.record(entry);
        log.debug("Computed {}", entry);
        return result;
    }

    @FunctionalInterface
    private interface ExactOperation {
        int apply();
    }
}
