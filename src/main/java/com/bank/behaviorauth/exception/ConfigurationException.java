package com.bank.behaviorauth.exception;

/**
 * Invalid engine configuration: threshold ordering, weight sum, non-positive limits.
 * Fatal at startup; a rejected hot-reload leaves the active settings untouched.
 */
public class ConfigurationException extends RuntimeException {

    private final String field;

    public ConfigurationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
