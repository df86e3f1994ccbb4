package nl.adgroot.img2pdf;

import java.nio.file.Path;
import java.util.List;
import nl.adgroot.img2pdf.discovery.ImageGroup;

/**
 * What happened to one group.
 * - output: written PDF, or null when nothing was written
 * - embedded: images that ended up as a page (in page order)
 */
public record GroupOutcome(
    ImageGroup group,
    Path output,
    List<String> embedded
) {

  public GroupOutcome {
    embedded = List.copyOf(embedded);
  }

  public static GroupOutcome notWritten(ImageGroup group, List<String> embedded) {
    return new GroupOutcome(group, null, embedded);
  }

  public boolean written() {
    return output != null;
  }

  /** Written, and every image of the group is in it: the sources may go. */
  public boolean complete() {
    return written() && embedded.size() == group.images().size();
  }

  public int pages() {
    return written() ? embedded.size() : 0;
  }
}
