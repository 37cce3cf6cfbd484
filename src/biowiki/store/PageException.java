package biowiki.store;

/**
 * Failure of a page or version operation. Callers switch on {@link #kind()}.
 */
public final class PageException extends Exception {
  public enum Kind {
    NOT_FOUND,
    NOT_DIRECTORY,
    INVALID_PATH,
    UTF8,
    NAME_MISMATCH,
    OVERWRITE,
    IO,
    SERIALIZATION
  }

  private final Kind kind;

  PageException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  PageException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  static PageException fromFileSystem(String message, Throwable cause) {
    Kind kind = StoreFiles.isNotFound(cause) ? Kind.NOT_FOUND : Kind.IO;
    return new PageException(kind, message, cause);
  }

  public Kind kind() {
    return kind;
  }
}
