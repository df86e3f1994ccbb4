package nl.adgroot.img2pdf.pdf;

public class PageLayoutEngine {

  /** 10 mm expressed in PDF points (1 pt = 1/72 inch). */
  public static final float DEFAULT_MARGIN = mmToPoints(10f);

  /**
   * Computes orientation, scale and centred placement for one image.
   *
   * <p>{@code pageWidth}/{@code pageHeight} describe the portrait page format; for landscape
   * images the two are swapped. The image keeps its aspect ratio and is scaled (up or down)
   * until it touches the margin box on one axis.
   *
   * @param imgW image width in pixels, must be &gt; 0
   * @param imgH image height in pixels, must be &gt; 0
   */
  public PageSpec computeLayout(float pageWidth, float pageHeight, float margin, int imgW, int imgH) {
    if (imgW <= 0 || imgH <= 0) {
      throw new IllegalArgumentException("Image dimensions must be positive: " + imgW + "x" + imgH);
    }

    Orientation orientation = Orientation.of(imgW, imgH);

    float shortSide = Math.min(pageWidth, pageHeight);
    float longSide = Math.max(pageWidth, pageHeight);
    float w = orientation == Orientation.LANDSCAPE ? longSide : shortSide;
    float h = orientation == Orientation.LANDSCAPE ? shortSide : longSide;

    float maxW = w - 2 * margin;
    float maxH = h - 2 * margin;

    double ratio = Math.min((double) maxW / imgW, (double) maxH / imgH);
    float scaledW = (float) (imgW * ratio);
    float scaledH = (float) (imgH * ratio);

    float x = (w - scaledW) / 2;
    float y = (h - scaledH) / 2;

    return new PageSpec(imgW, imgH, orientation, w, h, x, y, scaledW, scaledH);
  }

  public static float mmToPoints(float mm) {
    return mm / 25.4f * 72f;
  }
}
