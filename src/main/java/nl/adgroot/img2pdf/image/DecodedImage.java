package nl.adgroot.img2pdf.image;

/**
 * An image decoded to its pixel size and re-encoded as baseline RGB JPEG.
 */
public record DecodedImage(
    int width,
    int height,
    byte[] jpeg
) {}
