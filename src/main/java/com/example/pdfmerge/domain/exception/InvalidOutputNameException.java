package com.example.pdfmerge.domain.exception;

/**
 * Raised when a requested output name could escape the output area, e.g. {@code ../secret.pdf}.
 */
public class InvalidOutputNameException extends DomainException {

    public InvalidOutputNameException(String name) {
        super("Invalid file name: " + name);
    }
}
