package com.example.pdfmerge.infrastructure.exception;

/**
 * Base unchecked exception for infrastructure concerns (file system, PDFBox, image decoding).
 * Keeps library failures isolated from the domain language.
 */
public abstract class InfrastructureException extends RuntimeException {

    /**
     * Creates a new infrastructure exception while preserving the root cause.
     *
     * @param message context about the failure
     * @param cause   exception bubbling up from lower level libraries
     */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
