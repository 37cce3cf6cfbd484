package biowiki.store;

/**
 * Failure of an attachment operation. Callers switch on {@link #kind()}.
 */
public final class AttachmentException extends Exception {
  public enum Kind {
    NOT_FOUND,
    IO,
    SERIALIZATION,
    DECODE
  }

  private final Kind kind;

  AttachmentException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  AttachmentException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  static AttachmentException fromFileSystem(String message, Throwable cause) {
    Kind kind = StoreFiles.isNotFound(cause) ? Kind.NOT_FOUND : Kind.IO;
    return new AttachmentException(kind, message, cause);
  }

  public Kind kind() {
    return kind;
  }
}
