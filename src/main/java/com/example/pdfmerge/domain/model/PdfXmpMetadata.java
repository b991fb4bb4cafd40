package com.example.pdfmerge.domain.model;

/**
 * XMP basic schema values written into merged documents.
 */
public record PdfXmpMetadata(
        String creatorTool,
        String createDate
) {
}
