package com.example.pdfmerge.application.service;

import com.example.pdfmerge.domain.exception.InvalidOutputNameException;
import com.example.pdfmerge.domain.exception.OutputNotFoundException;
import com.example.pdfmerge.domain.model.ArtifactHandle;
import com.example.pdfmerge.domain.model.StorageArea;
import com.example.pdfmerge.infrastructure.storage.ArtifactStore;

import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Application-layer service that hands out merged documents by name.
 */
@Service
public class OutputDocumentService {

    private static final Pattern OUTPUT_NAME = Pattern.compile("[A-Za-z0-9_-][A-Za-z0-9._-]*");

    private final ArtifactStore artifactStore;

    public OutputDocumentService(ArtifactStore artifactStore) {
        this.artifactStore = artifactStore;
    }

    /**
     * Loads a merged document for download.
     *
     * @param name generated output name, e.g. {@code merged_20240101_120000_0a1b2c3d.pdf}
     * @return PDF bytes
     * @throws InvalidOutputNameException when the name is not a plain file name
     * @throws OutputNotFoundException    when no merged document of that name exists
     */
    public byte[] open(String name) {
        if (name == null || !OUTPUT_NAME.matcher(name).matches()) {
            throw new InvalidOutputNameException(name);
        }
        ArtifactHandle handle = artifactStore.find(StorageArea.OUTPUT, name)
                .orElseThrow(() -> new OutputNotFoundException(name));
        return artifactStore.load(handle);
    }
}
