package nl.adgroot.img2pdf.pdf;

import java.util.Locale;
import org.apache.pdfbox.pdmodel.common.PDRectangle;

public final class PageFormats {

  private PageFormats() {
    // utility class
  }

  /** Portrait page size for a format name (A3, A4, A5, LETTER, LEGAL). */
  public static PDRectangle byName(String name) {
    if (name == null || name.isBlank()) {
      return PDRectangle.A4;
    }
    return switch (name.trim().toUpperCase(Locale.ROOT)) {
      case "A3" -> PDRectangle.A3;
      case "A4" -> PDRectangle.A4;
      case "A5" -> PDRectangle.A5;
      case "LETTER" -> PDRectangle.LETTER;
      case "LEGAL" -> PDRectangle.LEGAL;
      default -> throw new IllegalArgumentException("Unknown page format: " + name);
    };
  }
}
