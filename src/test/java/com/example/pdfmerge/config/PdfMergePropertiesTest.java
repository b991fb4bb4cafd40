package com.example.pdfmerge.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for validation of the pipeline settings.
 */
class PdfMergePropertiesTest {

    @Test
    void zeroCancelGraceIsAccepted() {
        PdfMergeProperties.Pipeline pipeline = new PdfMergeProperties.Pipeline(1, Duration.ofSeconds(1), Duration.ZERO);

        assertThat(pipeline.cancelGrace()).isZero();
    }

    /**
     * A negative grace or a missing one is a configuration error reported at startup.
     */
    @Test
    void negativeCancelGraceIsRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new PdfMergeProperties.Pipeline(1, Duration.ofSeconds(1), Duration.ofMillis(-1)));

        assertThat(ex.getMessage()).contains("cancel-grace");
        assertThrows(IllegalArgumentException.class,
                () -> new PdfMergeProperties.Pipeline(1, Duration.ofSeconds(1), null));
    }

    @Test
    void nonPositiveJobTimeoutIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new PdfMergeProperties.Pipeline(1, Duration.ZERO, Duration.ofSeconds(1)));
    }
}
