package com.example.pdfmerge.infrastructure.pdf;

import com.example.pdfmerge.domain.model.ArtifactHandle;
import com.example.pdfmerge.domain.model.ConvertedDocument;
import com.example.pdfmerge.domain.model.PdfDocumentMetadata;
import com.example.pdfmerge.domain.model.SourceKind;
import com.example.pdfmerge.domain.model.StorageArea;
import com.example.pdfmerge.infrastructure.exception.PdfProcessingException;
import com.example.pdfmerge.support.InMemoryArtifactStore;
import com.example.pdfmerge.support.TestDocuments;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests covering ordered PDF assembly.
 */
class DocumentAssemblerTest {

    private final InMemoryArtifactStore store = new InMemoryArtifactStore();
    private final DocumentAssembler assembler = new DocumentAssembler(store);

    /**
     * A single input is copied byte for byte.
     *
     * @throws IOException when the fixture cannot be created
     */
    @Test
    void singleDocumentIsCopied() throws IOException {
        byte[] pdf = TestDocuments.pdf("Only");
        ConvertedDocument only = document(0, "only.pdf", pdf);
        ByteArrayOutputStream target = new ByteArrayOutputStream();

        assembler.assemble(List.of(only), target);

        assertThat(target.toByteArray()).isEqualTo(pdf);
    }

    /**
     * Pages appear in input order, each input contributing all of its pages.
     *
     * @throws IOException when the fixtures cannot be created or the result cannot be parsed
     */
    @Test
    void pagesFollowInputOrder() throws IOException {
        List<ConvertedDocument> documents = List.of(
                document(0, "a.pdf", TestDocuments.pdf("Alpha")),
                document(1, "b.pdf", TestDocuments.pdf("Bravo", "Charlie")),
                document(2, "c.pdf", TestDocuments.pdf("Delta")));
        ByteArrayOutputStream target = new ByteArrayOutputStream();

        assembler.assemble(documents, target);

        try (PDDocument merged = Loader.loadPDF(target.toByteArray())) {
            assertThat(merged.getNumberOfPages()).isEqualTo(4);
            assertThat(pageTexts(merged)).containsExactly("Alpha", "Bravo", "Charlie", "Delta");
        }
    }

    /**
     * The merged document records who produced it, in the info dictionary and in XMP.
     *
     * @throws IOException when the fixtures cannot be created
     */
    @Test
    void mergedDocumentCarriesProducerMetadata() throws IOException {
        List<ConvertedDocument> documents = List.of(
                document(0, "a.pdf", TestDocuments.pdf("Alpha")),
                document(1, "b.pdf", TestDocuments.pdf("Bravo")));
        ByteArrayOutputStream target = new ByteArrayOutputStream();

        assembler.assemble(documents, target);
        PdfDocumentMetadata metadata = new PdfBoxMetadataReader().readMetadata(target.toByteArray());

        assertThat(metadata.pageCount()).isEqualTo(2);
        assertThat(metadata.infoDictionary().producer()).isEqualTo(DocumentAssembler.PRODUCER);
        assertThat(metadata.infoDictionary().creationDate()).isNotNull();
        assertThat(metadata.xmpMetadata()).isNotNull();
        assertThat(metadata.xmpMetadata().creatorTool()).isEqualTo(DocumentAssembler.PRODUCER);
    }

    /**
     * One unreadable input fails the whole assembly before anything is written.
     *
     * @throws IOException when the fixture cannot be created
     */
    @Test
    void unreadableInputFailsWithoutOutput() throws IOException {
        List<ConvertedDocument> documents = List.of(
                document(0, "a.pdf", TestDocuments.pdf("Alpha")),
                document(1, "broken.pdf", "not a pdf at all".getBytes(StandardCharsets.US_ASCII)));
        ByteArrayOutputStream target = new ByteArrayOutputStream();

        PdfProcessingException ex = assertThrows(PdfProcessingException.class, () -> assembler.assemble(documents, target));

        assertThat(ex.getMessage()).contains("broken.pdf");
        assertThat(target.size()).isZero();
    }

    @Test
    void emptyInputIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> assembler.assemble(List.of(), new ByteArrayOutputStream()));
    }

    private ConvertedDocument document(int position, String name, byte[] pdf) {
        ArtifactHandle handle = store.store(StorageArea.UPLOADS, position + "_" + name, pdf);
        return new ConvertedDocument(position, name, SourceKind.DOCUMENT, handle);
    }

    private static List<String> pageTexts(PDDocument document) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        List<String> texts = new ArrayList<>();
        for (int page = 1; page <= document.getNumberOfPages(); page++) {
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            texts.add(stripper.getText(document).trim());
        }
        return texts;
    }
}
