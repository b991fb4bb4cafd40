package com.example.pdfmerge.application.exception;

/**
 * Raised when the thread running a merge job is interrupted, e.g. because the client went away.
 */
public class JobCancelledException extends JobAbortedException {

    private static final String MESSAGE = "The merge job was cancelled.";

    public JobCancelledException(String jobId) {
        super(jobId, MESSAGE);
    }

    /**
     * @param jobId job that was cancelled
     * @param cause failure the interrupt caused in the step that was running
     */
    public JobCancelledException(String jobId, Throwable cause) {
        super(jobId, MESSAGE, cause);
    }
}
