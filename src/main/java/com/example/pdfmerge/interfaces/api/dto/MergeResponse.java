package com.example.pdfmerge.interfaces.api.dto;

import com.example.pdfmerge.domain.model.OutputDocument;

/**
 * API-layer DTO returned after a successful merge.
 */
public record MergeResponse(
        String status,
        String downloadUrl,
        String filename,
        int pageCount,
        long sizeBytes
) {
    /**
     * @param output stored merged document
     * @return response pointing at the download endpoint
     */
    public static MergeResponse success(OutputDocument output) {
        return new MergeResponse("success", "/download/" + output.name(), output.name(), output.pageCount(), output.sizeBytes());
    }
}
