package com.ragguard.exception;

/**
 * Invalid client request. Reported as a 400 and never retried.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
