package com.example.pdfmerge.interfaces.api;

import com.example.pdfmerge.application.service.ConversionPipeline;
import com.example.pdfmerge.application.service.OutputDocumentService;
import com.example.pdfmerge.domain.exception.NoFilesException;
import com.example.pdfmerge.domain.model.OutputDocument;
import com.example.pdfmerge.domain.model.SourceFile;
import com.example.pdfmerge.infrastructure.exception.ArtifactStoreException;
import com.example.pdfmerge.interfaces.api.dto.MergeResponse;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Interfaces-layer controller for uploading files to merge and downloading the merged PDF.
 */
@Controller
public class MergeController {

    private final ConversionPipeline conversionPipeline;
    private final OutputDocumentService outputDocumentService;

    /**
     * Creates the controller with the required application services.
     *
     * @param conversionPipeline    service running merge jobs
     * @param outputDocumentService service serving merged documents
     */
    public MergeController(ConversionPipeline conversionPipeline, OutputDocumentService outputDocumentService) {
        this.conversionPipeline = conversionPipeline;
        this.outputDocumentService = outputDocumentService;
    }

    /**
     * Converts and merges the uploaded files. The order of the {@code files} parts is the page order of the result.
     *
     * @param files PDF, PNG and JPEG uploads
     * @return JSON pointing at the merged document
     */
    @PostMapping(value = "/upload", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<MergeResponse> upload(@RequestParam(value = "files", required = false) List<MultipartFile> files) {
        OutputDocument output = conversionPipeline.run(toSourceFiles(files));
        return ResponseEntity.ok(MergeResponse.success(output));
    }

    /**
     * Streams a merged document as an attachment.
     *
     * @param filename name returned by {@link #upload(List)}
     * @return PDF document as a {@link ResponseEntity}
     */
    @GetMapping("/download/{filename}")
    public ResponseEntity<byte[]> download(@PathVariable String filename) {
        byte[] pdf = outputDocumentService.open(filename);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment().filename(filename).build().toString())
                .contentType(MediaType.APPLICATION_PDF)
                .body(pdf);
    }

    /**
     * Classifies the uploads in request order; an unsupported file rejects the request before any work starts.
     *
     * @param files multipart uploads, possibly {@code null}
     * @return source files in request order
     */
    private List<SourceFile> toSourceFiles(List<MultipartFile> files) {
        if (files == null || files.isEmpty()) {
            throw new NoFilesException();
        }
        List<SourceFile> sources = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            try {
                sources.add(SourceFile.of(file.getOriginalFilename(), file.getBytes()));
            } catch (IOException e) {
                throw new ArtifactStoreException("Error opening file: " + file.getOriginalFilename(), e);
            }
        }
        return sources;
    }
}
