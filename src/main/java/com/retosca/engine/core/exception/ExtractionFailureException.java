package com.retosca.engine.core.exception;

/**
 * Raised when the plan document is malformed or lacks its resource root. Aborts the run.
 */
public class ExtractionFailureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ExtractionFailureException(String message) {
        super(message);
    }

    public ExtractionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
