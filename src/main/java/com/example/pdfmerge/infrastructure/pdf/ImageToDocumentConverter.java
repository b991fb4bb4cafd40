package com.example.pdfmerge.infrastructure.pdf;

import com.example.pdfmerge.domain.model.FitResult;
import com.example.pdfmerge.domain.model.PageGeometry;
import com.example.pdfmerge.domain.model.SourceFile;
import com.example.pdfmerge.domain.service.PageFitter;
import com.example.pdfmerge.infrastructure.exception.ImageDecodingException;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.MemoryCacheImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Infrastructure service that turns a PNG or JPEG upload into a one-page A4 PDF with the image centred on it.
 * Decoding happens fully in memory; no intermediate image file is written.
 */
@Service
public class ImageToDocumentConverter {

    private static final Logger log = LoggerFactory.getLogger(ImageToDocumentConverter.class);
    static final float POINTS_PER_MILLIMETRE = 72f / 25.4f;

    private final PageFitter pageFitter = new PageFitter();

    /**
     * Converts a raster image and writes the resulting PDF to {@code target}.
     *
     * @param image  classified upload, must be a raster image
     * @param target stream receiving the PDF bytes
     * @return placement of the image on the page, in millimetres
     * @throws ImageDecodingException when the bytes are not a decodable image
     * @throws com.example.pdfmerge.domain.exception.InvalidImageException when the image has no pixels
     * @throws IOException when {@code target} cannot be written
     */
    public FitResult convert(SourceFile image, OutputStream target) throws IOException {
        if (!image.isRasterImage()) {
            throw new IllegalArgumentException("Not a raster image: " + image.name());
        }
        BufferedImage decoded = decode(image);
        PageGeometry geometry = PageGeometry.A4;
        FitResult fit = pageFitter.fit(decoded.getWidth(), decoded.getHeight(), geometry);

        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(new PDRectangle(toPoints(geometry.pageWidth()), toPoints(geometry.pageHeight())));
            document.addPage(page);

            PDImageXObject xObject = embed(document, image, decoded);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.drawImage(xObject,
                        toPoints(fit.offsetX()),
                        toPoints(fit.offsetY()),
                        toPoints(fit.renderWidth()),
                        toPoints(fit.renderHeight()));
            }
            document.save(target);
        }

        log.debug("Converted {} ({}x{} px) at scale {}", image.name(), decoded.getWidth(), decoded.getHeight(), fit.scale());
        return fit;
    }

    /**
     * Decodes the upload with ImageIO, reading through a memory cache instead of ImageIO's temp-file cache.
     *
     * @param image upload to decode
     * @return decoded pixels
     */
    private BufferedImage decode(SourceFile image) {
        try (ImageInputStream input = new MemoryCacheImageInputStream(new ByteArrayInputStream(image.content()))) {
            BufferedImage decoded = ImageIO.read(input);
            if (decoded == null) {
                throw new ImageDecodingException("Error opening image " + image.name() + ": unrecognised image data.", null);
            }
            return decoded;
        } catch (IOException e) {
            throw new ImageDecodingException("Error opening image " + image.name() + ": " + e.getMessage(), e);
        }
    }

    /**
     * JPEG data is embedded as-is (DCT stream), everything else losslessly from the decoded pixels.
     */
    private PDImageXObject embed(PDDocument document, SourceFile image, BufferedImage decoded) {
        try {
            if (isJpeg(image)) {
                return JPEGFactory.createFromByteArray(document, image.content());
            }
            return LosslessFactory.createFromImage(document, decoded);
        } catch (IOException | IllegalArgumentException e) {
            throw new ImageDecodingException("Unable to embed image " + image.name() + ": " + e.getMessage(), e);
        }
    }

    private static boolean isJpeg(SourceFile image) {
        byte[] content = image.content();
        return content.length > 2 && (content[0] & 0xFF) == 0xFF && (content[1] & 0xFF) == 0xD8;
    }

    static float toPoints(double millimetres) {
        return (float) (millimetres * POINTS_PER_MILLIMETRE);
    }
}
