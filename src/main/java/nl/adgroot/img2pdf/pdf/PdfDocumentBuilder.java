package nl.adgroot.img2pdf.pdf;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.PDPageContentStream.AppendMode;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

/**
 * Builds exactly one output PDF, one page per image.
 *
 * <p><b>Important:</b> must be closed; it owns an open {@link PDDocument}.</p>
 */
public class PdfDocumentBuilder implements AutoCloseable {

  private final PDDocument document = new PDDocument();
  private final PDRectangle pageFormat;
  private PDPage currentPage;

  public PdfDocumentBuilder() {
    this(PDRectangle.A4);
  }

  /** @param pageFormat portrait page size, rotated for landscape pages */
  public PdfDocumentBuilder(PDRectangle pageFormat) {
    this.pageFormat = pageFormat;
  }

  public void newPage(Orientation orientation) {
    PDRectangle box = orientation == Orientation.LANDSCAPE
        ? new PDRectangle(pageFormat.getHeight(), pageFormat.getWidth())
        : new PDRectangle(pageFormat.getWidth(), pageFormat.getHeight());

    currentPage = new PDPage(box);
    document.addPage(currentPage);
  }

  public void placeImage(byte[] jpeg, float x, float y, float w, float h) throws IOException {
    if (currentPage == null) {
      throw new IllegalStateException("placeImage called before newPage");
    }
    draw(JPEGFactory.createFromByteArray(document, jpeg), x, y, w, h);
  }

  /**
   * newPage + placeImage for a computed layout. The JPEG is embedded before the page is
   * created, and the page is removed again if drawing fails, so a failure never leaves a
   * blank page behind.
   */
  public void addPage(PageSpec spec, byte[] jpeg) throws IOException {
    PDImageXObject image = JPEGFactory.createFromByteArray(document, jpeg);
    newPage(spec.orientation());
    try {
      draw(image, spec.x(), spec.y(), spec.width(), spec.height());
    } catch (IOException e) {
      document.removePage(currentPage);
      currentPage = null;
      throw e;
    }
  }

  private void draw(PDImageXObject image, float x, float y, float w, float h) throws IOException {
    try (PDPageContentStream cs = new PDPageContentStream(document, currentPage, AppendMode.APPEND, true)) {
      cs.drawImage(image, x, y, w, h);
    }
  }

  public int pageCount() {
    return document.getNumberOfPages();
  }

  public byte[] serialize() throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    document.save(out);
    return out.toByteArray();
  }

  @Override
  public void close() throws IOException {
    document.close();
  }
}
