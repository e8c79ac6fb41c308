package com.bank.behaviorauth.exception;

/**
 * Request rejected before it enters the pipeline. No user state is mutated.
 */
public class ValidationException extends RuntimeException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
