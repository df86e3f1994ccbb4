package nl.adgroot.img2pdf.pdf;

import java.nio.file.Files;
import java.nio.file.Path;

public class OutputNamer {

  private final Path outputDir;

  public OutputNamer(Path outputDir) {
    this.outputDir = outputDir;
  }

  /**
   * Returns {@code base.pdf}, or the first free {@code base (n).pdf} with n = 1, 2, ...
   *
   * <p>Check-then-create is not atomic across processes: a single run is assumed to own the
   * output directory. Callers write with {@code CREATE_NEW} so a lost race fails instead of
   * overwriting.</p>
   */
  public synchronized Path resolve(String baseName) {
    Path candidate = outputDir.resolve(baseName + ".pdf");
    int counter = 1;
    while (Files.exists(candidate)) {
      candidate = outputDir.resolve(baseName + " (" + counter + ").pdf");
      counter++;
    }
    return candidate;
  }

  public Path getOutputDir() {
    return outputDir;
  }
}
