package biowiki.store;

/**
 * Failure of a web collection operation.
 */
public final class WebException extends Exception {
  public enum Kind {
    INVALID_NAME,
    OVERWRITE,
    IO
  }

  private final Kind kind;

  WebException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  WebException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
