package nl.adgroot.img2pdf.discovery;

import java.nio.file.Path;
import java.util.List;
import nl.adgroot.img2pdf.result.ConversionError;

/**
 * Result of scanning one input.
 * - groups: ZIP groups first (archives in path order), then directory groups in path order
 * - archives: every ZIP that was opened successfully
 * - errors: unreadable archives and walk failures; those parts are skipped
 */
public record Discovery(
    List<ImageGroup> groups,
    List<Path> archives,
    List<ConversionError> errors
) {

  public Discovery {
    groups = List.copyOf(groups);
    archives = List.copyOf(archives);
    errors = List.copyOf(errors);
  }
}
