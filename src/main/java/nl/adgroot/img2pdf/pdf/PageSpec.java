package nl.adgroot.img2pdf.pdf;

/**
 * Geometry of one image page.
 * - pageWidth/pageHeight: size of the oriented page
 * - x, y, width, height: placement of the scaled image, centred on the page
 */
public record PageSpec(
    int imageWidth,
    int imageHeight,
    Orientation orientation,
    float pageWidth,
    float pageHeight,
    float x,
    float y,
    float width,
    float height
) {}
