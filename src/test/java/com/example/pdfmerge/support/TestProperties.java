package com.example.pdfmerge.support;

import com.example.pdfmerge.config.PdfMergeProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Property sets for tests that wire components by hand.
 */
public final class TestProperties {

    private TestProperties() {
    }

    public static PdfMergeProperties forDirectories(Path uploads, Path output) {
        return forDirectories(uploads, output, Duration.ofSeconds(30));
    }

    public static PdfMergeProperties forDirectories(Path uploads, Path output, Duration jobTimeout) {
        return new PdfMergeProperties(
                new PdfMergeProperties.Storage(uploads.toString(), output.toString()),
                new PdfMergeProperties.Pipeline(2, jobTimeout, Duration.ofSeconds(5)));
    }
}
