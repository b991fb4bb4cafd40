package com.example.pdfmerge.infrastructure.exception;

/**
 * Signals that an artifact could not be written, read or deleted.
 */
public class ArtifactStoreException extends InfrastructureException {

    /**
     * @param message description naming the artifact
     * @param cause   underlying I/O exception
     */
    public ArtifactStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
