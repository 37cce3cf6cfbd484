package biowiki.store;

/**
 * Listing entry for a stored attachment, by file name only.
 */
public final class AttachmentStub {
  private final String fileName;

  public AttachmentStub(String fileName) {
    this.fileName = fileName;
  }

  public String fileName() {
    return fileName;
  }
}
