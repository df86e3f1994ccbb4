package nl.adgroot.img2pdf.result;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a run (or of one input): PDFs created plus every non-fatal error.
 */
public record ConversionResult(
    int pdfsCreated,
    List<ConversionError> errors
) {

  public ConversionResult {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public static ConversionResult empty() {
    return new ConversionResult(0, List.of());
  }

  public ConversionResult plus(ConversionResult other) {
    List<ConversionError> all = new ArrayList<>(errors);
    all.addAll(other.errors);
    return new ConversionResult(pdfsCreated + other.pdfsCreated, all);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
