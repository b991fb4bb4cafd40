package com.example.pdfmerge.domain.service;

import com.example.pdfmerge.domain.exception.InvalidImageException;
import com.example.pdfmerge.domain.model.FitResult;
import com.example.pdfmerge.domain.model.PageGeometry;

import java.util.Objects;

/**
 * Computes where an image goes on a page.
 * One image pixel is taken as one unit of the page geometry; images larger than the printable area are scaled
 * down by the binding dimension, smaller images keep their size. The result is always centred on the full page.
 */
public final class PageFitter {

    /**
     * Fits an image of the given pixel size into {@code geometry}.
     *
     * @param imageWidthPx  image width in pixels
     * @param imageHeightPx image height in pixels
     * @param geometry      target page
     * @return scale, rendered size and offsets of the image
     * @throws InvalidImageException when either dimension is not positive
     */
    public FitResult fit(int imageWidthPx, int imageHeightPx, PageGeometry geometry) {
        Objects.requireNonNull(geometry, "geometry");
        if (imageWidthPx <= 0 || imageHeightPx <= 0) {
            throw new InvalidImageException(imageWidthPx, imageHeightPx);
        }

        double width = imageWidthPx;
        double height = imageHeightPx;
        double scale = 1.0;
        if (width > geometry.marginedWidth() || height > geometry.marginedHeight()) {
            double scaleX = geometry.marginedWidth() / width;
            double scaleY = geometry.marginedHeight() / height;
            scale = Math.min(scaleX, scaleY);
        }

        double renderWidth = width * scale;
        double renderHeight = height * scale;
        double offsetX = (geometry.pageWidth() - renderWidth) / 2;
        double offsetY = (geometry.pageHeight() - renderHeight) / 2;
        return new FitResult(scale, renderWidth, renderHeight, offsetX, offsetY);
    }
}
