package nl.adgroot.img2pdf.image;

import java.util.Locale;
import java.util.Set;

public final class ImageExtensions {

  /** Extensions accepted both on disk and inside ZIP archives (compared lower-case). */
  public static final Set<String> IMAGE_EXTENSIONS = Set.of(".png", ".jpg", ".jpeg", ".gif", ".bmp");

  public static final String ZIP_EXTENSION = ".zip";

  private ImageExtensions() {
    // utility class
  }

  public static boolean isImage(String fileName) {
    if (fileName == null) return false;
    String lower = fileName.toLowerCase(Locale.ROOT);
    for (String ext : IMAGE_EXTENSIONS) {
      if (lower.endsWith(ext)) return true;
    }
    return false;
  }

  public static boolean isZip(String fileName) {
    return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(ZIP_EXTENSION);
  }

  /** "photos.zip" -> "photos", "a.b.zip" -> "a.b", "noext" -> "noext". */
  public static String stripExtension(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }
}
