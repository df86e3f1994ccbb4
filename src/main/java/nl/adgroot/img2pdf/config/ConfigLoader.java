package nl.adgroot.img2pdf.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ConfigLoader {

  public static final String DEFAULT_RESOURCE = "/config.json";

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT);

  private ConfigLoader() {
    // utility class
  }

  public static AppConfig load(Path configPath) throws IOException {
    AppConfig cfg = MAPPER.readValue(configPath.toFile(), AppConfig.class);
    return fillMissingSections(cfg);
  }

  /** Bundled {@code config.json}, or built-in defaults when the resource is missing. */
  public static AppConfig loadDefault() throws IOException {
    try (InputStream is = ConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (is == null) {
        return new AppConfig();
      }
      return fillMissingSections(MAPPER.readValue(is, AppConfig.class));
    }
  }

  public static void save(AppConfig cfg, Path configPath) throws IOException {
    Path parent = configPath.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    MAPPER.writeValue(configPath.toFile(), cfg);
  }

  // "output": null in the file would otherwise leave a null section
  private static AppConfig fillMissingSections(AppConfig cfg) {
    if (cfg.output == null) cfg.output = new AppConfig.OutputConfig();
    if (cfg.page == null) cfg.page = new AppConfig.PageConfig();
    if (cfg.image == null) cfg.image = new AppConfig.ImageConfig();
    return cfg;
  }
}
