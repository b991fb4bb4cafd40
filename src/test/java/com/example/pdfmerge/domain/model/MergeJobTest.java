package com.example.pdfmerge.domain.model;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the merge job lifecycle.
 */
class MergeJobTest {

    private final SourceFile source = SourceFile.of("a.pdf", "data".getBytes(StandardCharsets.UTF_8));

    @Test
    void newJobIsReceived() {
        MergeJob job = MergeJob.create("job-1", List.of(source));

        assertThat(job.state()).isEqualTo(JobState.RECEIVED);
        assertThat(job.jobId()).isEqualTo("job-1");
        assertThat(job.sources()).containsExactly(source);
        assertThat(job.documents()).isEmpty();
        assertThat(job.createdAt()).isNotNull();
    }

    /**
     * Walks through the successful lifecycle.
     */
    @Test
    void successfulJobReachesDone() {
        MergeJob job = MergeJob.create("job-1", List.of(source));
        ConvertedDocument document = new ConvertedDocument(0, "a.pdf", SourceKind.DOCUMENT,
                new ArtifactHandle(StorageArea.UPLOADS, "job-1_0_a.pdf"));

        job.transitionTo(JobState.CONVERTING);
        job.startAssembling(List.of(document));
        assertThat(job.state()).isEqualTo(JobState.ASSEMBLING);
        assertThat(job.documents()).containsExactly(document);

        job.transitionTo(JobState.DONE);
        assertThat(job.state().isTerminal()).isTrue();
    }

    @Test
    void skippingStatesIsRejected() {
        MergeJob job = MergeJob.create("job-1", List.of(source));

        assertThrows(IllegalStateException.class, () -> job.transitionTo(JobState.ASSEMBLING));
        assertThrows(IllegalStateException.class, () -> job.transitionTo(JobState.DONE));
        assertThat(job.state()).isEqualTo(JobState.RECEIVED);
    }

    /**
     * A failed job stays failed, and a finished job cannot fail afterwards.
     */
    @Test
    void failIsTerminal() {
        MergeJob failed = MergeJob.create("job-1", List.of(source));
        failed.transitionTo(JobState.CONVERTING);

        assertThat(failed.fail()).isEqualTo(JobState.CONVERTING);
        assertThat(failed.state()).isEqualTo(JobState.FAILED);
        assertThrows(IllegalStateException.class, () -> failed.transitionTo(JobState.ASSEMBLING));

        MergeJob done = MergeJob.create("job-2", List.of(source));
        done.transitionTo(JobState.CONVERTING);
        done.startAssembling(List.of());
        done.transitionTo(JobState.DONE);
        assertThat(done.fail()).isEqualTo(JobState.DONE);
        assertThat(done.state()).isEqualTo(JobState.DONE);
    }

    @Test
    void terminalStatesHaveNoSuccessors() {
        for (JobState next : JobState.values()) {
            assertThat(JobState.DONE.canTransitionTo(next)).isFalse();
            assertThat(JobState.FAILED.canTransitionTo(next)).isFalse();
        }
    }
}
