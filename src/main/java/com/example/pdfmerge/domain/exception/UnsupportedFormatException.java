package com.example.pdfmerge.domain.exception;

/**
 * Raised when a file extension is neither a PDF nor one of the supported raster image formats.
 * A single unsupported file rejects the whole upload; nothing is merged partially.
 */
public class UnsupportedFormatException extends DomainException {

    /**
     * Creates the exception and mentions the offending file so the user can react.
     *
     * @param fileName original file name supplied by the client
     */
    public UnsupportedFormatException(String fileName) {
        super("Unsupported file format" + (fileName != null ? ": " + fileName : ".")
                + " Only .pdf, .png, .jpg and .jpeg files can be merged.");
    }
}
