package com.example.pdfmerge.domain.exception;

/**
 * Raised when a download refers to a merged document that does not exist (anymore).
 */
public class OutputNotFoundException extends DomainException {

    /**
     * Creates the exception and records the missing name as part of the message.
     *
     * @param name output document name requested by the client
     */
    public OutputNotFoundException(String name) {
        super("File not found: " + name);
    }
}
