package biowiki.store;

/**
 * Listing entry for a page version, keyed by content hash.
 */
public final class VersionStub {
  private final String hash;

  public VersionStub(String hash) {
    this.hash = hash;
  }

  public String hash() {
    return hash;
  }
}
