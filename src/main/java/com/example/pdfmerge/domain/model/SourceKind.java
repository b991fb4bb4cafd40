package com.example.pdfmerge.domain.model;

import com.example.pdfmerge.domain.exception.UnsupportedFormatException;

import java.util.Locale;

/**
 * Classification of an uploaded file, derived from its extension.
 * Documents are merged as they are, raster images are first turned into a one-page document.
 */
public enum SourceKind {
    DOCUMENT,
    RASTER_IMAGE;

    /**
     * Classifies a file name by its extension, ignoring case.
     *
     * @param fileName original file name as supplied by the client
     * @return kind of the file
     * @throws UnsupportedFormatException when the extension is missing or not one of pdf, png, jpg, jpeg
     */
    public static SourceKind fromFileName(String fileName) {
        String extension = extensionOf(fileName);
        return switch (extension) {
            case "pdf" -> DOCUMENT;
            case "png", "jpg", "jpeg" -> RASTER_IMAGE;
            default -> throw new UnsupportedFormatException(fileName);
        };
    }

    /**
     * @param fileName file name, possibly {@code null}
     * @return lower-case extension without the dot, or an empty string
     */
    static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
