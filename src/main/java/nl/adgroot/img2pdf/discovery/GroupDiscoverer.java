package nl.adgroot.img2pdf.discovery;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import nl.adgroot.img2pdf.image.ImageExtensions;
import nl.adgroot.img2pdf.input.InputItem;
import nl.adgroot.img2pdf.result.ConversionError;
import nl.adgroot.img2pdf.result.ErrorKind;

public class GroupDiscoverer {

  public Discovery discover(InputItem item) {
    return switch (item.kind()) {
      case ZIP_FILE -> discoverZip(item.path());
      case DIRECTORY -> discoverDirectory(item.path());
    };
  }

  /**
   * One group per virtual directory of the archive that holds images. The archive is only
   * listed here; image bytes are streamed later.
   */
  public Discovery discoverZip(Path zipPath) {
    List<ImageGroup> groups = new ArrayList<>();
    List<ConversionError> errors = new ArrayList<>();

    Map<String, List<String>> imagesByDir = new LinkedHashMap<>();
    try (ZipFile zip = ZipArchives.open(zipPath)) {
      Enumeration<? extends ZipEntry> entries = zip.entries();
      while (entries.hasMoreElements()) {
        ZipEntry entry = entries.nextElement();
        if (entry.isDirectory()) continue;

        String name = entry.getName();
        if (!ImageExtensions.isImage(name)) continue;

        imagesByDir.computeIfAbsent(zipDirectory(name), k -> new ArrayList<>()).add(name);
      }
    } catch (IOException | RuntimeException e) {
      // ZipFile reports malformed entry names as IllegalArgumentException
      errors.add(new ConversionError(zipPath.toString(), ErrorKind.ARCHIVE, "Cannot read ZIP: " + e.getMessage()));
      return new Discovery(List.of(), List.of(), errors);
    }

    String zipBase = ImageExtensions.stripExtension(fileName(zipPath));
    for (Map.Entry<String, List<String>> e : imagesByDir.entrySet()) {
      String dir = e.getKey();
      String baseName = dir.isEmpty() ? zipBase : zipBase + "_" + dir.replace('/', '_');
      groups.add(new ImageGroup(zipPath, SourceKind.ZIP, dir, baseName, e.getValue()));
    }

    return new Discovery(groups, List.of(zipPath), errors);
  }

  /**
   * Every directory (root included) that directly contains images forms its own group;
   * every ZIP anywhere below the root contributes the groups of {@link #discoverZip}.
   * Unreadable entries are recorded and skipped.
   */
  public Discovery discoverDirectory(Path root) {
    Map<Path, List<String>> imagesByDir = new TreeMap<>();
    List<Path> zips = new ArrayList<>();
    List<ConversionError> errors = new ArrayList<>();

    try {
      Files.walkFileTree(root, new SimpleFileVisitor<>() {
        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
          // links to files count, links to directories are not followed
          if (!attrs.isRegularFile() && !(attrs.isSymbolicLink() && Files.isRegularFile(file))) {
            return FileVisitResult.CONTINUE;
          }

          String name = fileName(file);
          if (ImageExtensions.isZip(name)) {
            zips.add(file);
          } else if (ImageExtensions.isImage(name)) {
            imagesByDir.computeIfAbsent(file.getParent(), k -> new ArrayList<>()).add(name);
          }
          return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
          errors.add(new ConversionError(file.toString(), ErrorKind.WALK, "Cannot access: " + exc.getMessage()));
          return FileVisitResult.CONTINUE;
        }
      });
    } catch (IOException e) {
      errors.add(new ConversionError(root.toString(), ErrorKind.WALK, "Cannot scan directory: " + e.getMessage()));
    }

    List<ImageGroup> groups = new ArrayList<>();
    List<Path> archives = new ArrayList<>();

    zips.sort(null);
    for (Path zip : zips) {
      Discovery fromZip = discoverZip(zip);
      groups.addAll(fromZip.groups());
      archives.addAll(fromZip.archives());
      errors.addAll(fromZip.errors());
    }

    for (Map.Entry<Path, List<String>> e : imagesByDir.entrySet()) {
      String key = relativeKey(root, e.getKey());
      String baseName = key.isEmpty() ? rootName(root) : key.replace('/', '_');
      groups.add(new ImageGroup(e.getKey(), SourceKind.DIRECTORY, key, baseName, e.getValue()));
    }

    return new Discovery(groups, archives, errors);
  }

  /** Directory part of an entry name with '\' normalised to '/'; "" for root entries. */
  static String zipDirectory(String entryName) {
    String normalized = entryName.replace('\\', '/');
    int slash = normalized.lastIndexOf('/');
    if (slash < 0) return "";

    String dir = normalized.substring(0, slash);
    // tolerate "/a.png" and "./a.png" style names
    while (dir.startsWith("/")) dir = dir.substring(1);
    if (dir.equals(".")) return "";
    if (dir.startsWith("./")) dir = dir.substring(2);
    return dir;
  }

  static String relativeKey(Path root, Path dir) {
    Path rel = root.relativize(dir);
    List<String> parts = new ArrayList<>();
    for (Path p : rel) {
      String s = p.toString();
      if (!s.isEmpty()) parts.add(s);
    }
    return String.join("/", parts);
  }

  private static String rootName(Path root) {
    Path name = root.toAbsolutePath().normalize().getFileName();
    return name == null ? "images" : name.toString();
  }

  private static String fileName(Path path) {
    Path name = path.getFileName();
    return name == null ? path.toString() : name.toString();
  }
}
