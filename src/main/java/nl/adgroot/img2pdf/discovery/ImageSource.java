package nl.adgroot.img2pdf.discovery;

import java.io.Closeable;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Reads the bytes of one image of a group. ZIP entries are streamed from the archive,
 * nothing is extracted to disk.
 */
public interface ImageSource extends Closeable {

  byte[] read(String image) throws IOException;

  static ImageSource open(ImageGroup group) throws IOException {
    return switch (group.kind()) {
      case DIRECTORY -> new DirectorySource(group.source());
      case ZIP -> new ZipSource(ZipArchives.open(group.source()));
    };
  }

  final class DirectorySource implements ImageSource {
    private final Path dir;

    DirectorySource(Path dir) {
      this.dir = dir;
    }

    @Override
    public byte[] read(String image) throws IOException {
      return Files.readAllBytes(dir.resolve(image));
    }

    @Override
    public void close() {
      // nothing held open
    }
  }

  final class ZipSource implements ImageSource {
    private final ZipFile zip;

    ZipSource(ZipFile zip) {
      this.zip = zip;
    }

    @Override
    public byte[] read(String image) throws IOException {
      ZipEntry entry = zip.getEntry(image);
      if (entry == null) {
        throw new FileNotFoundException("Entry not found in " + zip.getName() + ": " + image);
      }
      try (InputStream in = zip.getInputStream(entry)) {
        return in.readAllBytes();
      }
    }

    @Override
    public void close() throws IOException {
      zip.close();
    }
  }
}
