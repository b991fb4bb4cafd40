package com.example.pdfmerge.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals a PDF could not be read or written by PDFBox,
 * typically because an uploaded document is corrupt.
 */
public class PdfProcessingException extends InfrastructureException {

    /**
     * Creates the exception with a contextual message and the root cause from PDFBox.
     *
     * @param message description shared with the application layer
     * @param cause   low-level PDFBox exception
     */
    public PdfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
