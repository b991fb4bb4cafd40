package com.example.pdfmerge.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One upload-to-output processing unit. Lives for the duration of a single request and is never persisted.
 */
public final class MergeJob {

    private final String jobId;
    private final Instant createdAt;
    private final List<SourceFile> sources;
    private List<ConvertedDocument> documents = List.of();
    private JobState state = JobState.RECEIVED;

    private MergeJob(String jobId, Instant createdAt, List<SourceFile> sources) {
        this.jobId = jobId;
        this.createdAt = createdAt;
        this.sources = sources;
    }

    /**
     * Creates a job in state {@link JobState#RECEIVED}.
     *
     * @param jobId   unique identifier, also used to name the job's artifacts
     * @param sources files in submission order
     * @return new job
     */
    public static MergeJob create(String jobId, List<SourceFile> sources) {
        Objects.requireNonNull(jobId, "jobId");
        return new MergeJob(jobId, Instant.now(), List.copyOf(sources));
    }

    public String jobId() {
        return jobId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public List<SourceFile> sources() {
        return sources;
    }

    public synchronized List<ConvertedDocument> documents() {
        return documents;
    }

    public synchronized JobState state() {
        return state;
    }

    /**
     * Moves to {@link JobState#ASSEMBLING} and records the documents that are going to be merged.
     *
     * @param converted documents in submission order
     */
    public synchronized void startAssembling(List<ConvertedDocument> converted) {
        transitionTo(JobState.ASSEMBLING);
        this.documents = List.copyOf(converted);
    }

    /**
     * @param next state to move to
     * @throws IllegalStateException when the transition is not allowed from the current state
     */
    public synchronized void transitionTo(JobState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Job " + jobId + " cannot move from " + state + " to " + next);
        }
        state = next;
    }

    /**
     * Marks the job as failed unless it already reached a terminal state.
     *
     * @return the state the job was in when it failed
     */
    public synchronized JobState fail() {
        JobState previous = state;
        if (!state.isTerminal()) {
            state = JobState.FAILED;
        }
        return previous;
    }
}
