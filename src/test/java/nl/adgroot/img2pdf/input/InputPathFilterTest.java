package nl.adgroot.img2pdf.input;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import nl.adgroot.img2pdf.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InputPathFilterTest {

  @TempDir
  Path tmp;

  private final InputPathFilter filter = new InputPathFilter();

  private Path dirA;
  private Path dirB;
  private Path zip;

  @BeforeEach
  void setUp() throws Exception {
    dirA = Files.createDirectories(tmp.resolve("a"));
    dirB = Files.createDirectories(tmp.resolve("b"));
    zip = TestFixtures.zip(tmp.resolve("c.ZIP"), Map.of("x.png", new byte[] {1}));
  }

  @Test
  void select_acceptsDirectoriesAndZips_inOrder() {
    InputPathFilter.Selection s = filter.select(List.of(dirB, zip, dirA));

    assertEquals(List.of(
        new InputItem(dirB, InputKind.DIRECTORY),
        new InputItem(zip, InputKind.ZIP_FILE),
        new InputItem(dirA, InputKind.DIRECTORY)), s.accepted());
    assertTrue(s.rejected().isEmpty());
  }

  @Test
  void select_rejectsOtherFilesAndMissingPaths() throws Exception {
    Path txt = Files.writeString(tmp.resolve("notes.txt"), "x");
    Path missing = tmp.resolve("does-not-exist");

    InputPathFilter.Selection s = filter.select(List.of(txt, missing, dirA));

    assertEquals(1, s.accepted().size());
    assertEquals(2, s.rejected().size());
    assertEquals(txt, s.rejected().get(0).path());
    assertEquals(missing, s.rejected().get(1).path());
  }

  @Test
  void select_rejectsDuplicatesNestedAndEnclosingPaths() throws Exception {
    Path inner = Files.createDirectories(dirA.resolve("inner"));
    Path zipInA = TestFixtures.zip(dirA.resolve("in-a.zip"), Map.of("x.png", new byte[] {1}));

    InputPathFilter.Selection s = filter.select(List.of(inner, dirA, dirA.resolve("."), zipInA, dirB));

    // dirA encloses the earlier "inner"; the zip sits beside "inner", not in it
    assertEquals(List.of(inner, zipInA, dirB), s.accepted().stream().map(InputItem::path).toList());
    assertEquals(2, s.rejected().size());
    assertTrue(s.rejected().get(0).reason().contains("overlaps"));
  }

  @Test
  void select_checksAgainstExistingSelection() {
    List<InputItem> existing = List.of(new InputItem(dirA, InputKind.DIRECTORY));

    InputPathFilter.Selection s = filter.select(existing, List.of(dirA, dirB));

    assertEquals(List.of(new InputItem(dirB, InputKind.DIRECTORY)), s.accepted());
    assertEquals(1, s.rejected().size());
  }

  @Test
  void inputItem_of_normalisesToAbsolutePath() {
    InputItem item = InputItem.of(dirA.resolve("..").resolve("a")).orElseThrow();
    assertEquals(dirA.toAbsolutePath().normalize(), item.path());
    assertEquals(InputKind.DIRECTORY, item.kind());
  }
}
