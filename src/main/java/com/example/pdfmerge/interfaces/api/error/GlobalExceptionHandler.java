package com.example.pdfmerge.interfaces.api.error;

import com.example.pdfmerge.application.exception.ApplicationException;
import com.example.pdfmerge.application.exception.JobAbortedException;
import com.example.pdfmerge.application.exception.JobCancelledException;
import com.example.pdfmerge.application.exception.JobTimeoutException;
import com.example.pdfmerge.domain.exception.DomainException;
import com.example.pdfmerge.domain.exception.InvalidImageException;
import com.example.pdfmerge.domain.exception.NoFilesException;
import com.example.pdfmerge.domain.exception.OutputNotFoundException;
import com.example.pdfmerge.domain.exception.UnsupportedFormatException;
import com.example.pdfmerge.infrastructure.exception.ArtifactStoreException;
import com.example.pdfmerge.infrastructure.exception.ImageDecodingException;
import com.example.pdfmerge.infrastructure.exception.InfrastructureException;
import com.example.pdfmerge.infrastructure.exception.PdfProcessingException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.util.Map;

/**
 * Centralized API-layer exception handler that maps domain/application/infrastructure failures to HTTP responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(NoFilesException.class)
    public ResponseEntity<ErrorResponse> handleNoFiles(NoFilesException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "NO_FILES");
    }

    @ExceptionHandler(UnsupportedFormatException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedFormat(UnsupportedFormatException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "UNSUPPORTED_FORMAT");
    }

    @ExceptionHandler(InvalidImageException.class)
    public ResponseEntity<ErrorResponse> handleInvalidImage(InvalidImageException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "INVALID_IMAGE");
    }

    /**
     * Maps {@link OutputNotFoundException} to a 404 response.
     *
     * @param ex       thrown exception
     * @param request  incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(OutputNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleOutputNotFound(OutputNotFoundException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.NOT_FOUND, "OUTPUT_NOT_FOUND");
    }

    /**
     * Maps remaining domain validation exceptions to a 400 response.
     *
     * @param ex      thrown domain exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomain(DomainException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "DOMAIN_ERROR");
    }

    /**
     * Maps undecodable images to a 422 response; the upload was well-formed but its content is not usable.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(ImageDecodingException.class)
    public ResponseEntity<ErrorResponse> handleImageDecoding(ImageDecodingException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "DECODE_ERROR");
    }

    /**
     * Maps unreadable or unmergeable PDFs to a 422 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(PdfProcessingException.class)
    public ResponseEntity<ErrorResponse> handlePdfProcessing(PdfProcessingException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "MERGE_ERROR");
    }

    @ExceptionHandler(ArtifactStoreException.class)
    public ResponseEntity<ErrorResponse> handleArtifactStore(ArtifactStoreException ex, HttpServletRequest request) {
        log.error("Artifact store failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "IO_ERROR");
    }

    /**
     * Maps other infrastructure exceptions to a 500 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ErrorResponse> handleInfrastructure(InfrastructureException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "INFRASTRUCTURE_ERROR");
    }

    @ExceptionHandler(JobTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleJobTimeout(JobTimeoutException ex, HttpServletRequest request) {
        return buildAbortedResponse(ex, request, "JOB_TIMEOUT");
    }

    @ExceptionHandler(JobCancelledException.class)
    public ResponseEntity<ErrorResponse> handleJobCancelled(JobCancelledException ex, HttpServletRequest request) {
        return buildAbortedResponse(ex, request, "JOB_CANCELLED");
    }

    /**
     * Maps other application-layer exceptions to a 422 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<ErrorResponse> handleApplication(ApplicationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "APPLICATION_ERROR");
    }

    /**
     * Maps uploads above the per-file limit to a 413 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUploadSize(MaxUploadSizeExceededException ex, HttpServletRequest request) {
        ErrorResponse response = ErrorResponse.of(HttpStatus.PAYLOAD_TOO_LARGE.value(), "FILE_TOO_LARGE",
                "Uploaded file exceeds the maximum allowed size.", request.getRequestURI());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(response);
    }

    /**
     * Fallback for unexpected exceptions.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR");
    }

    private ResponseEntity<ErrorResponse> buildAbortedResponse(JobAbortedException ex, HttpServletRequest request, String errorCode) {
        HttpStatus status = HttpStatus.SERVICE_UNAVAILABLE;
        ErrorResponse response = ErrorResponse.of(status.value(), errorCode, ex.getMessage(), request.getRequestURI())
                .withDetails(Map.of("jobId", ex.getJobId()));
        return ResponseEntity.status(status).body(response);
    }

    /**
     * Central helper that creates a consistent {@link ErrorResponse} envelope.
     *
     * @param error    exception that triggered the handler
     * @param request  incoming HTTP request
     * @param status   HTTP status code to return
     * @param errorCode application-specific error code
     * @return response entity containing the serialized error
     */
    private ResponseEntity<ErrorResponse> buildResponse(Throwable error,
                                                       HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode) {
        ErrorResponse response = ErrorResponse.of(status.value(), errorCode, error.getMessage(), request.getRequestURI());
        return ResponseEntity.status(status).body(response);
    }
}
