package nl.adgroot.img2pdf;

import java.io.IOException;

/** The output directory cannot be created; nothing has been converted. */
public class OutputDirectoryException extends IOException {

  public OutputDirectoryException(String message, Throwable cause) {
    super(message, cause);
  }
}
