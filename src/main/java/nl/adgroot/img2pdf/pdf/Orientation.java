package nl.adgroot.img2pdf.pdf;

public enum Orientation {
  PORTRAIT,
  LANDSCAPE;

  /** Landscape only for strictly wider images; square images stay portrait. */
  public static Orientation of(int imageWidth, int imageHeight) {
    return imageWidth > imageHeight ? LANDSCAPE : PORTRAIT;
  }
}
