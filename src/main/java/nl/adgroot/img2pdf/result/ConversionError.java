package nl.adgroot.img2pdf.result;

import org.jetbrains.annotations.NotNull;

public record ConversionError(String path, ErrorKind kind, String message) {

  @NotNull
  @Override
  public String toString() {
    return "[" + kind + "] " + path + ": " + message;
  }
}
