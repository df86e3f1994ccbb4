package nl.adgroot.img2pdf;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import nl.adgroot.img2pdf.config.AppConfig;
import nl.adgroot.img2pdf.discovery.Discovery;
import nl.adgroot.img2pdf.discovery.GroupDiscoverer;
import nl.adgroot.img2pdf.discovery.ImageGroup;
import nl.adgroot.img2pdf.discovery.ImageSource;
import nl.adgroot.img2pdf.discovery.SourceKind;
import nl.adgroot.img2pdf.image.DecodedImage;
import nl.adgroot.img2pdf.image.ImageCodec;
import nl.adgroot.img2pdf.input.InputItem;
import nl.adgroot.img2pdf.input.InputKind;
import nl.adgroot.img2pdf.pdf.OutputNamer;
import nl.adgroot.img2pdf.pdf.PageFormats;
import nl.adgroot.img2pdf.pdf.PageLayoutEngine;
import nl.adgroot.img2pdf.pdf.PageSpec;
import nl.adgroot.img2pdf.pdf.PdfDocumentBuilder;
import nl.adgroot.img2pdf.result.ConversionError;
import nl.adgroot.img2pdf.result.ConversionResult;
import nl.adgroot.img2pdf.result.ErrorKind;
import org.apache.pdfbox.pdmodel.common.PDRectangle;

public class ConversionOrchestrator {

  private final GroupDiscoverer discoverer;
  private final ImageCodec codec;
  private final PageLayoutEngine layout = new PageLayoutEngine();
  private final OutputNamer namer;
  private final PDRectangle pageFormat;
  private final float margin;
  private final boolean deleteSources;

  /** Production default */
  public ConversionOrchestrator(AppConfig cfg) {
    this(cfg, new GroupDiscoverer(), new OutputNamer(Path.of(cfg.output.directory).toAbsolutePath().normalize()));
  }

  /** Injectable for tests / alternative naming */
  public ConversionOrchestrator(AppConfig cfg, GroupDiscoverer discoverer, OutputNamer namer) {
    this.discoverer = discoverer;
    this.namer = namer;
    this.codec = new ImageCodec(cfg.image.jpegQuality, cfg.image.maxPixels);
    this.pageFormat = PageFormats.byName(cfg.page.format);
    this.margin = PageLayoutEngine.mmToPoints(cfg.page.marginMm);
    this.deleteSources = cfg.output.deleteSources;
  }

  /**
   * Converts every input, one after the other. Per-image, per-group and per-input failures are
   * collected in the result; only a missing output directory aborts, before any input is read.
   */
  public ConversionResult convertAll(List<InputItem> inputs) throws OutputDirectoryException {
    prepareOutputDirectory();

    ProgressTracker tracker = new ProgressTracker(inputs.size());
    ConversionResult total = ConversionResult.empty();

    for (InputItem item : inputs) {
      total = total.plus(convertItem(item, tracker));
      System.out.println(tracker.formatStatus());
    }
    return total;
  }

  /** Converts a single directory or ZIP path. */
  public ConversionResult convert(Path input) throws OutputDirectoryException {
    prepareOutputDirectory();

    Optional<InputItem> item = InputItem.of(input);
    if (item.isEmpty()) {
      return new ConversionResult(0, List.of(
          new ConversionError(input.toString(), ErrorKind.INPUT, "Not a directory or .zip file")));
    }
    return convertItem(item.get(), new ProgressTracker(1));
  }

  public void prepareOutputDirectory() throws OutputDirectoryException {
    Path outDir = namer.getOutputDir();
    try {
      Files.createDirectories(outDir);
    } catch (IOException e) {
      throw new OutputDirectoryException("Could not create output directory " + outDir + ": " + e.getMessage(), e);
    }
  }

  /**
   * Discovering -> converting each group -> cleanup -> done.
   * Loose images are deleted right after their group was written; archives and the directory
   * tree only after all groups of the input were handled.
   */
  ConversionResult convertItem(InputItem item, ProgressTracker tracker) {
    List<ConversionError> errors = new ArrayList<>();

    Discovery discovery = discoverer.discover(item);
    errors.addAll(discovery.errors());

    System.out.println("Scanned " + item.path() + ": " + discovery.groups().size() + " group(s), "
        + discovery.archives().size() + " archive(s)");

    // archive -> every image of every group embedded and written
    Map<Path, Boolean> archiveComplete = new LinkedHashMap<>();
    int created = 0;

    for (ImageGroup group : discovery.groups()) {
      GroupOutcome outcome = convertGroup(group, errors);

      if (outcome.written()) {
        created++;
        tracker.pdfWritten(outcome.pages());
      }

      if (group.kind() == SourceKind.ZIP) {
        archiveComplete.merge(group.source(), outcome.complete(), Boolean::logicalAnd);
      } else if (deleteSources && outcome.written()) {
        for (String image : outcome.embedded()) {
          deleteQuietly(group.source().resolve(image));
        }
      }
    }

    if (deleteSources) {
      archiveComplete.forEach((zip, complete) -> {
        if (complete) deleteQuietly(zip);
      });
      if (item.kind() == InputKind.DIRECTORY) {
        pruneEmptyDirectories(item.path());
      }
    }

    tracker.finishInput();
    return new ConversionResult(created, errors);
  }

  GroupOutcome convertGroup(ImageGroup group, List<ConversionError> errors) {
    List<String> embedded = new ArrayList<>();

    final ImageSource source;
    try {
      source = ImageSource.open(group);
    } catch (IOException e) {
      errors.add(new ConversionError(group.source().toString(), ErrorKind.ARCHIVE, "Cannot open: " + e.getMessage()));
      return GroupOutcome.notWritten(group, embedded);
    }

    Path written = null;
    int pages = 0;
    try (source; PdfDocumentBuilder builder = new PdfDocumentBuilder(pageFormat)) {
      for (String image : group.images()) {
        try {
          DecodedImage decoded = codec.decode(source.read(image));
          PageSpec spec = layout.computeLayout(
              pageFormat.getWidth(), pageFormat.getHeight(), margin, decoded.width(), decoded.height());
          builder.addPage(spec, decoded.jpeg());
          embedded.add(image);
        } catch (IOException e) {
          errors.add(new ConversionError(group.describe(image), ErrorKind.DECODE, e.getMessage()));
        }
      }

      if (embedded.isEmpty()) {
        System.err.println("SKIPPED " + group + ": no readable images");
        return GroupOutcome.notWritten(group, embedded);
      }

      pages = builder.pageCount();
      written = write(group, builder, errors);
    } catch (IOException e) {
      // closing the archive or the document failed; a PDF written before that stays valid
      errors.add(new ConversionError(group.source().toString(), ErrorKind.WRITE, "Cannot release resources: " + e.getMessage()));
    }

    if (written != null) {
      synchronized (System.out) {
        System.out.println("WROTE " + written.getFileName() + " (" + pages + " pages) <- " + group);
      }
    }
    return new GroupOutcome(group, written, embedded);
  }

  /** Serialises, picks a free name and writes with CREATE_NEW + fsync. Null on failure. */
  private Path write(ImageGroup group, PdfDocumentBuilder builder, List<ConversionError> errors) {
    byte[] pdf;
    try {
      pdf = builder.serialize();
    } catch (IOException e) {
      errors.add(new ConversionError(group.outputBaseName(), ErrorKind.WRITE, "Cannot serialize PDF: " + e.getMessage()));
      return null;
    }

    Path target = namer.resolve(group.outputBaseName());
    boolean created = false;
    try (FileChannel ch = FileChannel.open(target, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
      created = true;
      ByteBuffer buf = ByteBuffer.wrap(pdf);
      while (buf.hasRemaining()) {
        ch.write(buf);
      }
      ch.force(true);
      return target;
    } catch (IOException e) {
      errors.add(new ConversionError(target.toString(), ErrorKind.WRITE, "Cannot save PDF: " + e));
      if (created) {
        deleteQuietly(target);
      }
      return null;
    }
  }

  /**
   * Post-order pass over the input tree deleting every directory that is empty by now, the root
   * included. The output directory is never touched.
   */
  void pruneEmptyDirectories(Path root) {
    Path outDir = namer.getOutputDir().toAbsolutePath().normalize();
    try {
      Files.walkFileTree(root, new SimpleFileVisitor<>() {
        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
          return dir.toAbsolutePath().normalize().equals(outDir)
              ? FileVisitResult.SKIP_SUBTREE
              : FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
          return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
          try {
            Files.delete(dir);
          } catch (DirectoryNotEmptyException notEmpty) {
            // still holds files that were not converted
          } catch (IOException e) {
            System.err.println("Could not remove directory " + dir + ": " + e.getMessage());
          }
          return FileVisitResult.CONTINUE;
        }
      });
    } catch (IOException e) {
      System.err.println("Could not prune " + root + ": " + e.getMessage());
    }
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      System.err.println("Could not delete " + path + ": " + e.getMessage());
    }
  }

  public boolean isDeleteSources() {
    return deleteSources;
  }

  public Path getOutputDir() {
    return namer.getOutputDir();
  }
}
