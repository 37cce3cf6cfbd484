package biowiki.store;

/**
 * Listing entry for a web.
 */
public final class WebStub {
  private final String name;

  public WebStub(String name) {
    this.name = name;
  }

  public String name() {
    return name;
  }
}
