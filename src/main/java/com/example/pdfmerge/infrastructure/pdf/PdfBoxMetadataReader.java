package com.example.pdfmerge.infrastructure.pdf;

import com.example.pdfmerge.domain.model.PdfDocumentMetadata;
import com.example.pdfmerge.domain.model.PdfInfoDictionary;
import com.example.pdfmerge.domain.model.PdfXmpMetadata;
import com.example.pdfmerge.infrastructure.exception.PdfProcessingException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.xml.DomXmpParser;
import org.apache.xmpbox.xml.XmpParsingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Calendar;
import java.util.Optional;

/**
 * Infrastructure service that turns PDFBox metadata into structured DTOs consumed by the domain.
 * Used to describe merged documents before they are handed out for download.
 */
@Service
public class PdfBoxMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxMetadataReader.class);
    private static final DateTimeFormatter CALENDAR_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    /**
     * Parses a PDF and describes it.
     *
     * @param pdf complete PDF bytes
     * @return structured metadata
     * @throws PdfProcessingException when the bytes are not a readable PDF
     */
    public PdfDocumentMetadata readMetadata(byte[] pdf) {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            return readMetadata(document, pdf.length);
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the merged PDF.", e);
        }
    }

    /**
     * Reads the metadata from a {@link PDDocument} and maps it into our domain DTOs.
     *
     * @param document      already opened PDF document
     * @param fileSizeBytes size of the file the document was loaded from
     * @return structured metadata
     */
    public PdfDocumentMetadata readMetadata(PDDocument document, long fileSizeBytes) {
        return new PdfDocumentMetadata(
                document.getNumberOfPages(),
                String.valueOf(document.getVersion()),
                fileSizeBytes,
                extractInfo(document.getDocumentInformation()),
                extractXmp(document.getDocumentCatalog())
        );
    }

    /**
     * Extracts the provenance fields of the info dictionary.
     *
     * @param info info dictionary from PDFBox
     * @return mapped domain DTO or {@code null}
     */
    private PdfInfoDictionary extractInfo(PDDocumentInformation info) {
        if (info == null) {
            return null;
        }
        return new PdfInfoDictionary(
                info.getTitle(),
                info.getCreator(),
                info.getProducer(),
                formatCalendar(info.getCreationDate())
        );
    }

    /**
     * Extracts the XMP basic schema and converts it into the {@link PdfXmpMetadata} DTO.
     *
     * @param catalog document catalog pointer supplied by PDFBox
     * @return parsed XMP metadata or {@code null} if missing/invalid
     */
    private PdfXmpMetadata extractXmp(PDDocumentCatalog catalog) {
        PDMetadata pdMetadata = catalog != null ? catalog.getMetadata() : null;
        if (pdMetadata == null) {
            return null;
        }
        try (InputStream metadataStream = pdMetadata.exportXMPMetadata()) {
            if (metadataStream == null) {
                return null;
            }
            DomXmpParser parser = new DomXmpParser();
            parser.setStrictParsing(false);
            XMPMetadata xmp = parser.parse(metadataStream);
            XMPBasicSchema basic = xmp.getXMPBasicSchema();
            if (basic == null) {
                return null;
            }
            return new PdfXmpMetadata(basic.getCreatorTool(), formatCalendar(basic.getCreateDate()));
        } catch (IOException | XmpParsingException ex) {
            log.warn("Failed to parse XMP metadata", ex);
            return null;
        }
    }

    private String formatCalendar(Calendar calendar) {
        if (calendar == null) {
            return null;
        }
        return Optional.of(calendar.toInstant())
                .map(instant -> instant.atZone(ZoneId.systemDefault()))
                .map(CALENDAR_FORMATTER::format)
                .orElse(null);
    }
}
