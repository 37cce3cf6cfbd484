package biowiki.store;

/**
 * Checks for names that are used directly as one path component under a store directory.
 */
public final class Names {
  private Names() {
  }

  /**
   * True if {@code name} resolves to a direct child: non-empty, no separators, not {@code .} or {@code ..}.
   */
  public static boolean isPlainSegment(String name) {
    if (name == null || name.isEmpty()) {
      return false;
    }
    if (".".equals(name) || "..".equals(name)) {
      return false;
    }
    return name.indexOf('/') < 0 && name.indexOf('\\') < 0 && name.indexOf('\0') < 0;
  }
}
