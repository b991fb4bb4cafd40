package com.example.pdfmerge.infrastructure.pdf;

import com.example.pdfmerge.domain.model.ConvertedDocument;
import com.example.pdfmerge.infrastructure.exception.PdfProcessingException;
import com.example.pdfmerge.infrastructure.storage.ArtifactStore;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.multipdf.PDFMergerUtility;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.xml.XmpSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.xml.transform.TransformerException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.List;

/**
 * Infrastructure service that concatenates PDFs in the given order.
 * A single document is copied byte for byte; several documents are merged with {@link PDFMergerUtility}.
 */
@Service
public class DocumentAssembler {

    private static final Logger log = LoggerFactory.getLogger(DocumentAssembler.class);
    static final String PRODUCER = "pdf-merge";

    private final ArtifactStore artifactStore;

    /**
     * @param artifactStore store holding the documents to assemble
     */
    public DocumentAssembler(ArtifactStore artifactStore) {
        this.artifactStore = artifactStore;
    }

    /**
     * Writes the concatenation of {@code documents} to {@code target}.
     * Every input is parsed before the first page is appended, so a corrupt input fails the whole assembly
     * and nothing is written.
     *
     * @param documents documents in the order their pages should appear
     * @param target    stream receiving the merged PDF
     * @throws PdfProcessingException when an input cannot be parsed or appended
     * @throws IOException            when {@code target} cannot be written
     */
    public void assemble(List<ConvertedDocument> documents, OutputStream target) throws IOException {
        if (documents == null || documents.isEmpty()) {
            throw new IllegalArgumentException("At least one document is required for assembly.");
        }
        if (documents.size() == 1) {
            target.write(artifactStore.load(documents.get(0).artifact()));
            log.debug("Single document {} copied without merging", documents.get(0).sourceName());
            return;
        }

        List<PDDocument> sources = new ArrayList<>(documents.size());
        try {
            for (ConvertedDocument document : documents) {
                sources.add(load(document));
            }
            try (PDDocument merged = new PDDocument()) {
                PDFMergerUtility merger = new PDFMergerUtility();
                for (int i = 0; i < sources.size(); i++) {
                    append(merger, merged, sources.get(i), documents.get(i));
                }
                stampMetadata(merged);
                merged.save(target);
                log.debug("Merged {} documents into {} pages", documents.size(), merged.getNumberOfPages());
            }
        } finally {
            closeAll(sources);
        }
    }

    /**
     * Parses an input with PDFBox's lenient parser, which tolerates minor structural defects of real-world files.
     */
    private PDDocument load(ConvertedDocument document) {
        byte[] bytes = artifactStore.load(document.artifact());
        try {
            return Loader.loadPDF(bytes);
        } catch (IOException e) {
            throw new PdfProcessingException("Error merging PDFs: " + document.sourceName() + " is not a readable PDF.", e);
        }
    }

    private void append(PDFMergerUtility merger, PDDocument merged, PDDocument source, ConvertedDocument document) {
        try {
            merger.appendDocument(merged, source);
        } catch (IOException e) {
            throw new PdfProcessingException("Error merging PDFs: " + document.sourceName() + " could not be appended. " + e.getMessage(), e);
        }
    }

    /**
     * Records the producer and creation date in both the info dictionary and an XMP packet.
     *
     * @param merged destination document
     * @throws IOException when the XMP stream cannot be attached
     */
    private void stampMetadata(PDDocument merged) throws IOException {
        Calendar now = Calendar.getInstance();
        PDDocumentInformation info = merged.getDocumentInformation();
        info.setProducer(PRODUCER);
        info.setCreationDate(now);

        XMPMetadata xmp = XMPMetadata.createXMPMetadata();
        XMPBasicSchema basic = xmp.createAndAddXMPBasicSchema();
        basic.setCreatorTool(PRODUCER);
        basic.setCreateDate(now);

        ByteArrayOutputStream packet = new ByteArrayOutputStream();
        try {
            new XmpSerializer().serialize(xmp, packet, true);
        } catch (TransformerException e) {
            throw new PdfProcessingException("Unable to serialize XMP metadata for the merged document.", e);
        }
        PDMetadata metadata = new PDMetadata(merged);
        metadata.importXMPMetadata(packet.toByteArray());
        merged.getDocumentCatalog().setMetadata(metadata);
    }

    private static void closeAll(List<PDDocument> documents) {
        for (PDDocument document : documents) {
            try {
                document.close();
            } catch (IOException e) {
                log.warn("Failed to close a merge source", e);
            }
        }
    }
}
