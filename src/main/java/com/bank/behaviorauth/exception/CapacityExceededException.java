package com.bank.behaviorauth.exception;

public class CapacityExceededException extends RuntimeException {

    private final int limit;

    public CapacityExceededException(int limit) {
        super("Admission limit of " + limit + " concurrent sessions reached");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
