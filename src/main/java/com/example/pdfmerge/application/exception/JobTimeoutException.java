package com.example.pdfmerge.application.exception;

import java.time.Duration;

/**
 * Raised when a merge job does not finish its conversions within the configured job timeout.
 */
public class JobTimeoutException extends JobAbortedException {

    /**
     * @param jobId   identifier of the aborted job
     * @param timeout configured limit that was exceeded
     */
    public JobTimeoutException(String jobId, Duration timeout) {
        super(jobId, "Merging took longer than " + timeout.toSeconds() + " seconds and was aborted.");
    }
}
