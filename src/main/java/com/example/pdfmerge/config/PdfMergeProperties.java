package com.example.pdfmerge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Settings of the merge service, bound from the {@code pdfmerge.*} properties.
 * Immutable once bound and handed to the components that need it, so concurrent jobs never observe a change.
 *
 * @param storage  where uploads and merged documents are kept
 * @param pipeline worker pool and time limits of merge jobs
 */
@ConfigurationProperties(prefix = "pdfmerge")
public record PdfMergeProperties(@DefaultValue Storage storage, @DefaultValue Pipeline pipeline) {

    /**
     * @param uploadDir directory for per-job intermediates (staged uploads and converted pages)
     * @param outputDir directory for merged documents served for download
     */
    public record Storage(
            @DefaultValue("uploads") String uploadDir,
            @DefaultValue("output") String outputDir
    ) {
    }

    /**
     * @param parallelism number of files converted at the same time across all jobs
     * @param jobTimeout  limit for one job; an expired job fails and is cleaned up
     * @param cancelGrace how long a failed job waits for its cancelled conversions to stop before cleaning up
     */
    public record Pipeline(
            @DefaultValue("4") int parallelism,
            @DefaultValue("2m") Duration jobTimeout,
            @DefaultValue("10s") Duration cancelGrace
    ) {
        public Pipeline {
            if (parallelism < 1) {
                throw new IllegalArgumentException("pdfmerge.pipeline.parallelism must be at least 1");
            }
            if (jobTimeout == null || jobTimeout.isNegative() || jobTimeout.isZero()) {
                throw new IllegalArgumentException("pdfmerge.pipeline.job-timeout must be positive");
            }
            if (cancelGrace == null || cancelGrace.isNegative()) {
                throw new IllegalArgumentException("pdfmerge.pipeline.cancel-grace must not be negative");
            }
        }
    }
}
