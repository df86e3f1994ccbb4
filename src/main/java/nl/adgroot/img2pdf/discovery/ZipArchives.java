package nl.adgroot.img2pdf.discovery;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/** Opens archives the same way for listing and for streaming, so entry names line up. */
final class ZipArchives {

  // names written without the UTF-8 flag, e.g. by Windows Explorer
  static final Charset LEGACY_NAMES = Charset.forName("IBM437");

  private ZipArchives() {
  }

  static ZipFile open(Path zipPath) throws IOException {
    try {
      return new ZipFile(zipPath.toFile());
    } catch (ZipException | IllegalArgumentException utf8Failed) {
      try {
        return new ZipFile(zipPath.toFile(), LEGACY_NAMES);
      } catch (IOException | IllegalArgumentException e) {
        e.addSuppressed(utf8Failed);
        throw e;
      }
    }
  }
}
