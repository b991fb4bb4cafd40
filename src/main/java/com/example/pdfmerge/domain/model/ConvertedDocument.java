package com.example.pdfmerge.domain.model;

/**
 * A PDF ready for assembly, derived from exactly one {@link SourceFile}.
 *
 * @param position   zero-based index of the source in the submitted order
 * @param sourceName original file name of the source
 * @param origin     kind of the source; documents are passed through, images were converted
 * @param artifact   stored PDF
 */
public record ConvertedDocument(int position, String sourceName, SourceKind origin, ArtifactHandle artifact) {
}
