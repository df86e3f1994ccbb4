package nl.adgroot.img2pdf.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

  @TempDir
  Path tmp;

  @Test
  void load_partialFile_keepsDefaultsForMissingValues() throws Exception {
    Path file = Files.writeString(tmp.resolve("cfg.json"), """
        {
          "output": { "deleteSources": true },
          "page": null,
          "somethingNew": 42
        }
        """);

    AppConfig cfg = ConfigLoader.load(file);

    assertTrue(cfg.output.deleteSources);
    assertEquals("pdf_output", cfg.output.directory);
    assertNotNull(cfg.page, "null section should fall back to defaults");
    assertEquals("A4", cfg.page.format);
    assertEquals(10f, cfg.page.marginMm);
    assertEquals(0.75f, cfg.image.jpegQuality);
    assertEquals(178_956_970L, cfg.image.maxPixels);
  }

  @Test
  void save_thenLoad_preservesValues() throws Exception {
    AppConfig cfg = new AppConfig();
    cfg.output.directory = "/tmp/somewhere";
    cfg.output.deleteSources = true;
    cfg.page.format = "LETTER";
    cfg.image.jpegQuality = 0.9f;

    Path file = tmp.resolve("nested/settings.json");
    ConfigLoader.save(cfg, file);
    AppConfig back = ConfigLoader.load(file);

    assertEquals("/tmp/somewhere", back.output.directory);
    assertTrue(back.output.deleteSources);
    assertEquals("LETTER", back.page.format);
    assertEquals(0.9f, back.image.jpegQuality);
  }

  @Test
  void loadDefault_readsBundledConfig() throws Exception {
    AppConfig cfg = ConfigLoader.loadDefault();

    assertEquals("pdf_output", cfg.output.directory);
    assertFalse(cfg.output.deleteSources);
    assertEquals("A4", cfg.page.format);
  }

  @Test
  void load_invalidJson_throws() throws Exception {
    Path file = Files.writeString(tmp.resolve("bad.json"), "{ not json");
    assertThrows(java.io.IOException.class, () -> ConfigLoader.load(file));
  }
}
