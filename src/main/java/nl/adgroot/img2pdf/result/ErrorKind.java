package nl.adgroot.img2pdf.result;

public enum ErrorKind {
  /** input path missing or neither a directory nor a ZIP */
  INPUT,
  /** image unreadable or corrupt; the image is skipped */
  DECODE,
  /** ZIP could not be opened or listed; the archive is skipped */
  ARCHIVE,
  /** PDF could not be serialized or saved; the group produces no output */
  WRITE,
  /** file or directory could not be visited while scanning */
  WALK
}
