package com.ragguard.exception;

/**
 * A stored object could not be read or split as paginated PDF content
 */
public class PdfSplitException extends RuntimeException {

    public PdfSplitException(String message, Throwable cause) {
        super(message, cause);
    }
}
