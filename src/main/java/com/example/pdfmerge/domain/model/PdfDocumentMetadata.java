package com.example.pdfmerge.domain.model;

/**
 * Description of a stored PDF, produced by the infrastructure metadata reader.
 * Info and XMP parts are {@code null} when the document carries none.
 */
public record PdfDocumentMetadata(
        int pageCount,
        String pdfVersion,
        long fileSizeBytes,
        PdfInfoDictionary infoDictionary,
        PdfXmpMetadata xmpMetadata
) {
}
