package com.example.pdfmerge.domain.exception;

/**
 * Raised when one of the submitted files carries no bytes at all.
 */
public class EmptySourceFileException extends DomainException {

    /**
     * @param fileName original file name supplied by the client
     */
    public EmptySourceFileException(String fileName) {
        super("The uploaded file is empty: " + fileName);
    }
}
