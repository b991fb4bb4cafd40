package com.example.pdfmerge.infrastructure.storage;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Produces the content of an artifact into the stream handed over by the {@link ArtifactStore}.
 */
@FunctionalInterface
public interface ArtifactWriter {

    void write(OutputStream target) throws IOException;
}
