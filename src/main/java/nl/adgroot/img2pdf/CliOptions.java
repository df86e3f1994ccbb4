package nl.adgroot.img2pdf;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line.
 * - configFile / outputDir / deleteSources: null when not given (config value applies)
 */
public record CliOptions(
    Path configFile,
    Path outputDir,
    Boolean deleteSources,
    Path saveConfigTo,
    List<Path> inputs
) {

  public static final String USAGE = """
      Usage: img2pdf [options] INPUT...

        INPUT                 a folder or a .zip file; one PDF per folder that holds images
        -c, --config FILE     JSON config (default: bundled config.json)
        -o, --out DIR         output folder for the PDFs
        -d, --delete          delete converted images/ZIPs and emptied folders
            --keep            keep all source files (default)
            --save-config FILE  write the effective settings to FILE
        -h, --help            show this help
      """;

  public static CliOptions parse(String[] args) {
    Path config = null;
    Path out = null;
    Boolean delete = null;
    Path saveConfig = null;
    List<Path> inputs = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];

      switch (arg) {
        case "-c", "--config" -> {
          config = Path.of(requiredValue(args, i, arg));
          i++;
        }
        case "-o", "--out" -> {
          out = Path.of(requiredValue(args, i, arg));
          i++;
        }
        case "-d", "--delete" -> delete = true;
        case "--keep" -> delete = false;
        case "--save-config" -> {
          saveConfig = Path.of(requiredValue(args, i, arg));
          i++;
        }
        case "--" -> {
          for (int j = i + 1; j < args.length; j++) inputs.add(Path.of(args[j]));
          i = args.length;
        }
        default -> {
          if (arg.startsWith("-") && arg.length() > 1) {
            throw new IllegalArgumentException("Unknown option: " + arg);
          }
          inputs.add(Path.of(arg));
        }
      }
    }

    if (inputs.isEmpty()) {
      throw new IllegalArgumentException("At least one input folder or .zip file is required");
    }
    return new CliOptions(config, out, delete, saveConfig, List.copyOf(inputs));
  }

  public static boolean isHelp(String[] args) {
    for (String a : args) {
      if (a.equals("-h") || a.equals("--help")) return true;
    }
    return false;
  }

  private static String requiredValue(String[] args, int i, String option) {
    if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
      throw new IllegalArgumentException("Missing value for " + option);
    }
    return args[i + 1];
  }
}
