package com.example.pdfmerge.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a {@link MergeJob}.
 */
public enum JobState {
    RECEIVED,
    CONVERTING,
    ASSEMBLING,
    DONE,
    FAILED;

    /**
     * @param next candidate next state
     * @return whether the job may move from this state to {@code next}
     */
    public boolean canTransitionTo(JobState next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    private Set<JobState> successors() {
        return switch (this) {
            case RECEIVED -> EnumSet.of(CONVERTING, FAILED);
            case CONVERTING -> EnumSet.of(ASSEMBLING, FAILED);
            case ASSEMBLING -> EnumSet.of(DONE, FAILED);
            case DONE, FAILED -> EnumSet.noneOf(JobState.class);
        };
    }
}
