package nl.adgroot.img2pdf.input;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pure logic for building the list of inputs of a run.
 * Rejects paths that are not a directory or ZIP, and paths overlapping an already accepted
 * input (same path, inside it, or containing it).
 */
public class InputPathFilter {

  public record Rejected(Path path, String reason) {}

  public record Selection(List<InputItem> accepted, List<Rejected> rejected) {}

  public Selection select(List<Path> candidates) {
    return select(List.of(), candidates);
  }

  /**
   * @param existing inputs already selected earlier (kept, never re-checked)
   * @param candidates new paths, checked in order
   */
  public Selection select(List<InputItem> existing, List<Path> candidates) {
    List<InputItem> accepted = new ArrayList<>(existing);
    List<Rejected> rejected = new ArrayList<>();

    for (Path candidate : candidates) {
      Optional<InputItem> item = InputItem.of(candidate);
      if (item.isEmpty()) {
        rejected.add(new Rejected(candidate, "not a directory or .zip file"));
        continue;
      }

      InputItem overlap = findOverlap(accepted, item.get().path());
      if (overlap != null) {
        rejected.add(new Rejected(candidate, "overlaps with " + overlap.path()));
        continue;
      }
      accepted.add(item.get());
    }

    return new Selection(List.copyOf(accepted.subList(existing.size(), accepted.size())), rejected);
  }

  private static InputItem findOverlap(List<InputItem> accepted, Path path) {
    for (InputItem a : accepted) {
      if (path.startsWith(a.path()) || a.path().startsWith(path)) {
        return a;
      }
    }
    return null;
  }
}
