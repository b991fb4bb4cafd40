package com.example.pdfmerge.application.exception;

/**
 * Signals that a merge job was stopped before it finished. All artifacts of the job have been removed.
 */
public abstract class JobAbortedException extends ApplicationException {

    private final String jobId;

    protected JobAbortedException(String jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    protected JobAbortedException(String jobId, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
