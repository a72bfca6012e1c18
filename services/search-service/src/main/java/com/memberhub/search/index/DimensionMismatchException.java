package com.memberhub.search.index;

public class DimensionMismatchException extends RuntimeException {
    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("vector dimension " + actual + " does not match index dimension " + expected);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
