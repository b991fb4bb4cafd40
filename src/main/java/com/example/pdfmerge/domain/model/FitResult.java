package com.example.pdfmerge.domain.model;

/**
 * Placement of an image on a page, in the units of the {@link PageGeometry} it was computed for.
 * Offsets are measured from the page edge, so the image is centred on the full page.
 *
 * @param scale        factor applied to the image size, in (0, 1]
 * @param renderWidth  width of the placed image
 * @param renderHeight height of the placed image
 * @param offsetX      distance from the left page edge
 * @param offsetY      distance from the top (and, being centred, the bottom) page edge
 */
public record FitResult(double scale, double renderWidth, double renderHeight, double offsetX, double offsetY) {
}
