package nl.adgroot.img2pdf.image;

import java.io.IOException;

public class DecodeException extends IOException {

  public DecodeException(String message) {
    super(message);
  }

  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
