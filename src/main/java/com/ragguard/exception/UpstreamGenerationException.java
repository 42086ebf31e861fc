package com.ragguard.exception;

/**
 * The generative model call failed or returned an unusable response
 */
public class UpstreamGenerationException extends RuntimeException {

    public UpstreamGenerationException(String message) {
        super(message);
    }

    public UpstreamGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
