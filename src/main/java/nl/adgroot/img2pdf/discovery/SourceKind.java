package nl.adgroot.img2pdf.discovery;

public enum SourceKind {
  /** loose image files directly inside one directory */
  DIRECTORY,
  /** entries of one virtual directory inside a ZIP archive */
  ZIP
}
