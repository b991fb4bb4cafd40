package com.example.pdfmerge.domain.model;

/**
 * Physical page size and printable area, in millimetres.
 * The printable area is centred on the page, leaving symmetric margins.
 *
 * @param pageWidth      full page width
 * @param pageHeight     full page height
 * @param marginedWidth  printable width, at most {@code pageWidth}
 * @param marginedHeight printable height, at most {@code pageHeight}
 */
public record PageGeometry(double pageWidth, double pageHeight, double marginedWidth, double marginedHeight) {

    /** ISO A4 portrait with 10 mm margins on every side. */
    public static final PageGeometry A4 = new PageGeometry(210.0, 297.0, 190.0, 277.0);

    public PageGeometry {
        if (!(pageWidth > 0 && pageHeight > 0 && marginedWidth > 0 && marginedHeight > 0)) {
            throw new IllegalArgumentException("Page dimensions must be positive.");
        }
        if (marginedWidth > pageWidth || marginedHeight > pageHeight) {
            throw new IllegalArgumentException("Printable area must fit on the page.");
        }
    }
}
