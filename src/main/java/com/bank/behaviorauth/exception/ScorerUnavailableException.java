package com.bank.behaviorauth.exception;

/**
 * An external model timed out, failed or answered out of contract. Always
 * converted to a degraded signal; never reaches the caller.
 */
public class ScorerUnavailableException extends Exception {

    public ScorerUnavailableException(String message) {
        super(message);
    }

    public ScorerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
