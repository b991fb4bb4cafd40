package com.example.pdfmerge.infrastructure.storage;

import com.example.pdfmerge.domain.model.ArtifactHandle;
import com.example.pdfmerge.domain.model.StorageArea;

import java.util.Optional;

/**
 * Keeps the files a merge job reads and produces.
 * An artifact becomes visible under its name only once it is completely written, and a name is never reused.
 * Failures surface as {@link com.example.pdfmerge.infrastructure.exception.ArtifactStoreException}.
 */
public interface ArtifactStore {

    /**
     * Stores the given bytes.
     *
     * @param area    target area
     * @param name    file name, unique within the area
     * @param content bytes to store
     * @return handle of the stored artifact
     */
    ArtifactHandle store(StorageArea area, String name, byte[] content);

    /**
     * Stores whatever {@code writer} produces. If the writer fails, nothing is stored and its exception is
     * rethrown (wrapped when it is an {@link java.io.IOException}).
     *
     * @param area   target area
     * @param name   file name, unique within the area
     * @param writer content producer
     * @return handle of the stored artifact
     */
    ArtifactHandle store(StorageArea area, String name, ArtifactWriter writer);

    byte[] load(ArtifactHandle handle);

    /**
     * @param area area to look in
     * @param name file name
     * @return handle when a completely written artifact of that name exists
     */
    Optional<ArtifactHandle> find(StorageArea area, String name);

    long size(ArtifactHandle handle);

    /**
     * Removes an artifact. Deleting an artifact that does not exist is not an error.
     *
     * @param handle artifact to remove
     */
    void delete(ArtifactHandle handle);
}
