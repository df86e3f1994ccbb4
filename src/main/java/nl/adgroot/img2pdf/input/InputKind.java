package nl.adgroot.img2pdf.input;

public enum InputKind {
  ZIP_FILE,
  DIRECTORY
}
