package com.example.pdfmerge.application.exception;

/**
 * Base unchecked exception for failures in the application layer.
 * Thrown when a merge job cannot complete for reasons that lie in how the job ran rather than in its input.
 */
public abstract class ApplicationException extends RuntimeException {

    /**
     * Creates a new application-layer exception with the provided message.
     *
     * @param message human readable error description suitable for surfacing to the caller
     */
    protected ApplicationException(String message) {
        super(message);
    }

    /**
     * Creates a new application-layer exception that keeps the failure which stopped the job.
     *
     * @param message human readable error description suitable for surfacing to the caller
     * @param cause   underlying exception coming from deeper layers
     */
    protected ApplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
