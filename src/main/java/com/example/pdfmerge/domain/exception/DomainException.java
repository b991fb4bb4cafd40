package com.example.pdfmerge.domain.exception;

/**
 * Base type for all domain-level exceptions of the merge model.
 * Subclasses describe input that can never become part of a merged document, independent of how it was uploaded.
 */
public abstract class DomainException extends RuntimeException {

    /**
     * Creates a domain exception with a message that can be shown to the caller as-is.
     *
     * @param message explanation of which rule the input broke
     */
    protected DomainException(String message) {
        super(message);
    }
}
