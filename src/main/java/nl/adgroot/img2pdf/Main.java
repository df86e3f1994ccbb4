package nl.adgroot.img2pdf;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import nl.adgroot.img2pdf.config.AppConfig;
import nl.adgroot.img2pdf.config.ConfigLoader;
import nl.adgroot.img2pdf.input.InputItem;
import nl.adgroot.img2pdf.input.InputPathFilter;
import nl.adgroot.img2pdf.result.ConversionError;
import nl.adgroot.img2pdf.result.ConversionResult;

public class Main {

  static final int EXIT_OK = 0;
  static final int EXIT_ERRORS = 1;
  static final int EXIT_FATAL = 2;

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    if (args.length == 0 || CliOptions.isHelp(args)) {
      System.out.println(CliOptions.USAGE);
      return args.length == 0 ? EXIT_FATAL : EXIT_OK;
    }

    CliOptions options;
    AppConfig cfg;
    try {
      options = CliOptions.parse(args);
      cfg = options.configFile() != null
          ? ConfigLoader.load(options.configFile())
          : ConfigLoader.loadDefault();
    } catch (IllegalArgumentException | IOException e) {
      System.err.println(e.getMessage());
      System.err.println(CliOptions.USAGE);
      return EXIT_FATAL;
    }

    if (options.outputDir() != null) {
      cfg.output.directory = options.outputDir().toString();
    }
    if (options.deleteSources() != null) {
      cfg.output.deleteSources = options.deleteSources();
    }

    if (options.saveConfigTo() != null) {
      try {
        ConfigLoader.save(cfg, options.saveConfigTo());
      } catch (IOException e) {
        System.err.println("Could not save settings to " + options.saveConfigTo() + ": " + e.getMessage());
      }
    }

    InputPathFilter.Selection selection = new InputPathFilter().select(options.inputs());
    if (!selection.rejected().isEmpty()) {
      System.err.println(selection.rejected().size()
          + " item(s) were skipped because they are not a folder/.zip or overlap with other inputs:");
      for (InputPathFilter.Rejected r : selection.rejected()) {
        System.err.println("  " + r.path() + " (" + r.reason() + ")");
      }
    }
    List<InputItem> inputs = selection.accepted();
    if (inputs.isEmpty()) {
      System.err.println("Nothing to convert.");
      return EXIT_FATAL;
    }

    ConversionOrchestrator orchestrator;
    ConversionResult result;
    try {
      orchestrator = new ConversionOrchestrator(cfg);
      result = orchestrator.convertAll(inputs);
    } catch (IllegalArgumentException e) {
      System.err.println("Invalid configuration: " + e.getMessage());
      return EXIT_FATAL;
    } catch (OutputDirectoryException e) {
      System.err.println(e.getMessage());
      return EXIT_FATAL;
    }

    System.out.println(formatSummary(inputs.size(), result, orchestrator.getOutputDir(), orchestrator.isDeleteSources()));
    return result.hasErrors() ? EXIT_ERRORS : EXIT_OK;
  }

  static String formatSummary(int items, ConversionResult result, Path outDir, boolean deleted) {
    StringBuilder sb = new StringBuilder();
    sb.append("Done!\n\n")
        .append("Processed ").append(items).append(" item(s).\n")
        .append("Created ").append(result.pdfsCreated()).append(" .pdf files in:\n")
        .append(outDir.toAbsolutePath()).append("\n\n")
        .append("Note: ").append(deleted ? "Converted source files were deleted." : "Original files were KEPT intact.");

    if (result.hasErrors()) {
      sb.append("\n\n").append(result.errors().size()).append(" error(s):");
      for (ConversionError e : result.errors()) {
        sb.append("\n  ").append(e);
      }
    }
    return sb.toString();
  }
}
