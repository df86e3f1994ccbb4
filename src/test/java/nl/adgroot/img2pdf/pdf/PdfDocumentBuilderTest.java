package nl.adgroot.img2pdf.pdf;

import static org.junit.jupiter.api.Assertions.*;

import nl.adgroot.img2pdf.TestFixtures;
import nl.adgroot.img2pdf.image.DecodedImage;
import nl.adgroot.img2pdf.image.ImageCodec;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.junit.jupiter.api.Test;

class PdfDocumentBuilderTest {

  private final ImageCodec codec = new ImageCodec();
  private final PageLayoutEngine layout = new PageLayoutEngine();

  @Test
  void addPage_portraitAndLandscape_serializesLoadablePdf() throws Exception {
    DecodedImage tall = codec.decode(TestFixtures.png(100, 200));
    DecodedImage wide = codec.decode(TestFixtures.png(200, 100));

    byte[] pdf;
    try (PdfDocumentBuilder builder = new PdfDocumentBuilder(PDRectangle.A4)) {
      builder.addPage(layout(tall), tall.jpeg());
      builder.addPage(layout(wide), wide.jpeg());
      assertEquals(2, builder.pageCount());
      pdf = builder.serialize();
    }

    try (PDDocument doc = Loader.loadPDF(pdf)) {
      assertEquals(2, doc.getNumberOfPages());

      PDRectangle first = doc.getPage(0).getMediaBox();
      assertTrue(first.getHeight() > first.getWidth(), "first page should be portrait");

      PDRectangle second = doc.getPage(1).getMediaBox();
      assertTrue(second.getWidth() > second.getHeight(), "second page should be landscape");
      assertEquals(PDRectangle.A4.getHeight(), second.getWidth(), 0.01f);

      assertEquals(100, firstImage(doc.getPage(0)).getWidth());
      assertEquals(200, firstImage(doc.getPage(1)).getWidth());
    }
  }

  @Test
  void placeImage_beforeNewPage_throws() throws Exception {
    DecodedImage img = codec.decode(TestFixtures.png(10, 10));
    try (PdfDocumentBuilder builder = new PdfDocumentBuilder()) {
      assertThrows(IllegalStateException.class, () -> builder.placeImage(img.jpeg(), 0, 0, 10, 10));
      assertEquals(0, builder.pageCount());
    }
  }

  @Test
  void newPageThenPlaceImage_drawsOnCurrentPage() throws Exception {
    DecodedImage img = codec.decode(TestFixtures.png(40, 30));
    try (PdfDocumentBuilder builder = new PdfDocumentBuilder(PDRectangle.LETTER)) {
      builder.newPage(Orientation.LANDSCAPE);
      builder.placeImage(img.jpeg(), 20, 20, 400, 300);

      try (PDDocument doc = Loader.loadPDF(builder.serialize())) {
        PDPage page = doc.getPage(0);
        assertEquals(PDRectangle.LETTER.getHeight(), page.getMediaBox().getWidth(), 0.01f);
        assertEquals(40, firstImage(page).getWidth());
      }
    }
  }

  @Test
  void addPage_withInvalidJpeg_leavesNoBlankPage() throws Exception {
    DecodedImage good = codec.decode(TestFixtures.png(10, 10));
    try (PdfDocumentBuilder builder = new PdfDocumentBuilder()) {
      PageSpec spec = layout(good);
      assertThrows(Exception.class, () -> builder.addPage(spec, new byte[] {1, 2, 3}));
      assertEquals(0, builder.pageCount());
    }
  }

  private PageSpec layout(DecodedImage img) {
    return layout.computeLayout(PDRectangle.A4.getWidth(), PDRectangle.A4.getHeight(),
        PageLayoutEngine.DEFAULT_MARGIN, img.width(), img.height());
  }

  private static PDImageXObject firstImage(PDPage page) throws Exception {
    for (COSName name : page.getResources().getXObjectNames()) {
      if (page.getResources().getXObject(name) instanceof PDImageXObject img) {
        return img;
      }
    }
    fail("page has no image");
    return null;
  }
}
