package com.example.pdfmerge.infrastructure.exception;

/**
 * Signals that an uploaded image could not be decoded into pixels.
 */
public class ImageDecodingException extends InfrastructureException {

    /**
     * @param message description naming the offending file
     * @param cause   decoder exception, or {@code null} when no decoder recognised the data
     */
    public ImageDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
