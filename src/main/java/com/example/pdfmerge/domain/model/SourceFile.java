package com.example.pdfmerge.domain.model;

import com.example.pdfmerge.domain.exception.EmptySourceFileException;

import java.util.Objects;

/**
 * One uploaded file together with its classification.
 * Instances are only created through {@link #of(String, byte[])}, so a {@code SourceFile} is always of a supported kind.
 *
 * @param name    original file name supplied by the client
 * @param kind    classification derived from {@code name}
 * @param content raw bytes as uploaded
 */
public record SourceFile(String name, SourceKind kind, byte[] content) {

    public SourceFile {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(content, "content");
    }

    /**
     * Classifies and wraps an uploaded file.
     *
     * @param name    original file name
     * @param content uploaded bytes
     * @return classified source file
     * @throws com.example.pdfmerge.domain.exception.UnsupportedFormatException when the extension is not supported
     * @throws EmptySourceFileException when {@code content} is empty
     */
    public static SourceFile of(String name, byte[] content) {
        SourceKind kind = SourceKind.fromFileName(name);
        if (content == null || content.length == 0) {
            throw new EmptySourceFileException(name);
        }
        return new SourceFile(name, kind, content);
    }

    public boolean isRasterImage() {
        return kind == SourceKind.RASTER_IMAGE;
    }

    @Override
    public String toString() {
        return "SourceFile[name=" + name + ", kind=" + kind + ", bytes=" + content.length + "]";
    }
}
