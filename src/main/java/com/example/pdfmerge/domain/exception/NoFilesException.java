package com.example.pdfmerge.domain.exception;

/**
 * Raised when a merge job is requested without a single file to merge.
 */
public class NoFilesException extends DomainException {

    /**
     * Creates the exception with a user-friendly explanation.
     */
    public NoFilesException() {
        super("No files uploaded. Please choose at least one PDF, PNG or JPG file.");
    }
}
