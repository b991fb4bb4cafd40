package com.example.pdfmerge.application.service;

import com.example.pdfmerge.domain.exception.InvalidOutputNameException;
import com.example.pdfmerge.domain.exception.OutputNotFoundException;
import com.example.pdfmerge.domain.model.StorageArea;
import com.example.pdfmerge.support.InMemoryArtifactStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for handing out merged documents.
 */
class OutputDocumentServiceTest {

    private final InMemoryArtifactStore store = new InMemoryArtifactStore();
    private final OutputDocumentService service = new OutputDocumentService(store);

    @Test
    void openReturnsStoredBytes() {
        store.store(StorageArea.OUTPUT, "merged_20240101_120000_0a1b2c3d.pdf", new byte[]{7, 8, 9});

        assertThat(service.open("merged_20240101_120000_0a1b2c3d.pdf")).containsExactly(7, 8, 9);
    }

    /**
     * Intermediates in the upload area are never served.
     */
    @Test
    void uploadAreaIsNotServed() {
        store.store(StorageArea.UPLOADS, "job_0_a.pdf", new byte[]{1});

        OutputNotFoundException ex = assertThrows(OutputNotFoundException.class, () -> service.open("job_0_a.pdf"));
        assertThat(ex.getMessage()).isEqualTo("File not found: job_0_a.pdf");
    }

    @ParameterizedTest
    @ValueSource(strings = {"../secret.pdf", ".hidden.pdf", "a/b.pdf", "a\\b.pdf", "", "merged 1.pdf"})
    void unsafeNamesAreRejected(String name) {
        assertThrows(InvalidOutputNameException.class, () -> service.open(name));
    }

    @Test
    void nullNameIsRejected() {
        assertThrows(InvalidOutputNameException.class, () -> service.open(null));
    }
}
