package nl.adgroot.img2pdf.discovery;

import java.nio.file.Path;
import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * Images that end up in one PDF.
 * - source: the directory holding the images, or the ZIP archive
 * - key: path of the group relative to its input or archive ("" for the root), '/'-separated
 * - images: file names (DIRECTORY) or entry names (ZIP), sorted lexicographically
 */
public record ImageGroup(
    Path source,
    SourceKind kind,
    String key,
    String outputBaseName,
    List<String> images
) {

  public ImageGroup {
    if (images == null || images.isEmpty()) {
      throw new IllegalArgumentException("An image group needs at least one image: " + source + " [" + key + "]");
    }
    images = images.stream().sorted().toList();
  }

  public boolean isRoot() {
    return key.isEmpty();
  }

  /** Display path of one image, e.g. {@code /in/sub/a.png} or {@code /in/x.zip!/album/a.png}. */
  public String describe(String image) {
    return kind == SourceKind.ZIP ? source + "!/" + image : source.resolve(image).toString();
  }

  @NotNull
  @Override
  public String toString() {
    return outputBaseName + " (" + images.size() + " images from " + source + ")";
  }
}
