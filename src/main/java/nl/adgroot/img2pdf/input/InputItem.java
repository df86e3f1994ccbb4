package nl.adgroot.img2pdf.input;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import nl.adgroot.img2pdf.image.ImageExtensions;
import org.jetbrains.annotations.NotNull;

public record InputItem(Path path, InputKind kind) {

  /** Classifies an existing directory or {@code .zip} file; anything else is empty. */
  public static Optional<InputItem> of(Path path) {
    Path abs = path.toAbsolutePath().normalize();
    if (Files.isDirectory(abs)) {
      return Optional.of(new InputItem(abs, InputKind.DIRECTORY));
    }
    if (Files.isRegularFile(abs) && abs.getFileName() != null
        && ImageExtensions.isZip(abs.getFileName().toString())) {
      return Optional.of(new InputItem(abs, InputKind.ZIP_FILE));
    }
    return Optional.empty();
  }

  @NotNull
  @Override
  public String toString() {
    return kind + ":" + path;
  }
}
