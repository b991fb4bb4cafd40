package com.example.pdfmerge.application.service;

import com.example.pdfmerge.domain.model.ArtifactHandle;
import com.example.pdfmerge.infrastructure.exception.ArtifactStoreException;
import com.example.pdfmerge.infrastructure.storage.ArtifactStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Cleanup list of one merge job. Every artifact is registered right after it is created and deleted when the job
 * ends, most recent first. Artifacts registered after {@link #close()} (by conversions still finishing in the
 * background) are deleted on the spot.
 */
final class JobResources implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobResources.class);

    private final ArtifactStore artifactStore;
    private final Deque<ArtifactHandle> tracked = new ArrayDeque<>();
    private boolean closed;

    JobResources(ArtifactStore artifactStore) {
        this.artifactStore = artifactStore;
    }

    /**
     * Registers an artifact for deletion at the end of the job.
     *
     * @param handle newly created artifact
     * @return {@code handle}, for chaining
     */
    ArtifactHandle track(ArtifactHandle handle) {
        synchronized (this) {
            if (!closed) {
                tracked.push(handle);
                return handle;
            }
        }
        deleteQuietly(handle);
        return handle;
    }

    /**
     * Deletes an artifact now instead of at the end of the job.
     *
     * @param handle artifact that is no longer needed
     */
    void discard(ArtifactHandle handle) {
        synchronized (this) {
            tracked.remove(handle);
        }
        deleteQuietly(handle);
    }

    /**
     * Takes an artifact off the list so it survives the job.
     *
     * @param handle artifact to keep
     */
    synchronized void keep(ArtifactHandle handle) {
        tracked.remove(handle);
    }

    synchronized int size() {
        return tracked.size();
    }

    @Override
    public void close() {
        List<ArtifactHandle> pending;
        synchronized (this) {
            closed = true;
            pending = new ArrayList<>(tracked);
            tracked.clear();
        }
        for (ArtifactHandle handle : pending) {
            deleteQuietly(handle);
        }
    }

    private void deleteQuietly(ArtifactHandle handle) {
        try {
            artifactStore.delete(handle);
        } catch (ArtifactStoreException e) {
            log.warn("Could not delete {} from {}", handle.name(), handle.area(), e);
        }
    }
}
