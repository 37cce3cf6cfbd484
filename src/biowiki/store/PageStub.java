package biowiki.store;

/**
 * Listing entry for a page within a web.
 */
public final class PageStub {
  private final String name;

  public PageStub(String name) {
    this.name = name;
  }

  public String name() {
    return name;
  }
}
