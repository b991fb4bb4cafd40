package com.example.pdfmerge.domain.exception;

/**
 * Raised when an image reports a width or height that cannot be placed on a page.
 */
public class InvalidImageException extends DomainException {

    /**
     * @param width  reported pixel width
     * @param height reported pixel height
     */
    public InvalidImageException(int width, int height) {
        super("Image dimensions must be positive but were " + width + "x" + height + ".");
    }
}
