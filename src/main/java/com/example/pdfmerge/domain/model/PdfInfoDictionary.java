package com.example.pdfmerge.domain.model;

/**
 * Subset of the PDF info dictionary that describes where a document came from.
 */
public record PdfInfoDictionary(
        String title,
        String creator,
        String producer,
        String creationDate
) {
}
