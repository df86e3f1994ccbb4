package nl.adgroot.img2pdf.image;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ImageExtensionsTest {

  @Test
  void isImage_isCaseInsensitive_andLimitedToKnownFormats() {
    assertTrue(ImageExtensions.isImage("a.png"));
    assertTrue(ImageExtensions.isImage("B.JPG"));
    assertTrue(ImageExtensions.isImage("scan.Jpeg"));
    assertTrue(ImageExtensions.isImage("anim.gif"));
    assertTrue(ImageExtensions.isImage("dir/old.BMP"));

    assertFalse(ImageExtensions.isImage("photo.tiff"));
    assertFalse(ImageExtensions.isImage("notes.txt"));
    assertFalse(ImageExtensions.isImage("png"));
    assertFalse(ImageExtensions.isImage(null));
  }

  @Test
  void isZip_andStripExtension() {
    assertTrue(ImageExtensions.isZip("Photos.ZIP"));
    assertFalse(ImageExtensions.isZip("photos.zip.txt"));

    assertEquals("photos", ImageExtensions.stripExtension("photos.zip"));
    assertEquals("a.b", ImageExtensions.stripExtension("a.b.zip"));
    assertEquals("noext", ImageExtensions.stripExtension("noext"));
    assertEquals(".hidden", ImageExtensions.stripExtension(".hidden"));
  }
}
