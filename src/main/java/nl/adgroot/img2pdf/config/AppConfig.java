package nl.adgroot.img2pdf.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {

  public OutputConfig output = new OutputConfig();
  public PageConfig page = new PageConfig();
  public ImageConfig image = new ImageConfig();

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class OutputConfig {
    // created when missing; relative paths resolve against the working directory
    public String directory = "pdf_output";

    // delete embedded images/ZIPs and prune emptied folders after a successful write
    public boolean deleteSources = false;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class PageConfig {
    // A3, A4, A5, LETTER or LEGAL (portrait size; landscape pages are rotated)
    public String format = "A4";
    public float marginMm = 10f;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ImageConfig {
    // 0 < q <= 1
    public float jpegQuality = 0.75f;

    // larger images are reported as unreadable instead of being decoded
    public long maxPixels = 178_956_970L;
  }
}
