package biowiki.store;

import java.util.Locale;

/**
 * Content types served for attachments, chosen from the file extension alone.
 */
public enum MimeType {
  PNG("image/png"),
  JPEG("image/jpeg"),
  OCTET_STREAM("application/octet-stream");

  private final String value;

  MimeType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * Maps a file name to its content type; unknown or missing extensions are octet-stream.
   */
  public static MimeType forFileName(String fileName) {
    if (fileName == null) {
      return OCTET_STREAM;
    }
    int dot = fileName.lastIndexOf('.');
    // a leading dot marks a hidden file, not an extension
    if (dot <= 0 || dot == fileName.length() - 1) {
      return OCTET_STREAM;
    }
    switch (fileName.substring(dot + 1).toLowerCase(Locale.ROOT)) {
      case "png":
        return PNG;
      case "jpg":
      case "jpeg":
        return JPEG;
      default:
        return OCTET_STREAM;
    }
  }

  @Override
  public String toString() {
    return value;
  }
}
