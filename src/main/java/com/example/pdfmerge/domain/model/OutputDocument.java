package com.example.pdfmerge.domain.model;

import java.time.Instant;

/**
 * The merged artifact of a finished job, addressable by {@code name} until it is removed externally.
 *
 * @param name      generated file name within the output area
 * @param sizeBytes size of the stored file
 * @param pageCount number of pages
 * @param createdAt time the job was received
 * @param metadata  document description
 */
public record OutputDocument(
        String name,
        long sizeBytes,
        int pageCount,
        Instant createdAt,
        PdfDocumentMetadata metadata
) {
}
