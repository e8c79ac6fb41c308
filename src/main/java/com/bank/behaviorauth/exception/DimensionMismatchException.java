package com.bank.behaviorauth.exception;

public class DimensionMismatchException extends ValidationException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("behavioralVector", "Vector dimension " + actual + " does not match configured dimension " + expected);
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
