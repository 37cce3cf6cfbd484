package biowiki.store;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.FileSystem;
import io.vertx.core.file.FileSystemException;

import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * A page directory and its current detail.
 *
 * <p>On disk a page is {@code <web>/<name>/page.json} plus optional {@code versions/} and
 * {@code attachments/} subdirectories. The directory name always equals the detail name;
 * {@link #open} refuses pages where the two have drifted apart.
 */
public final class Page {
  private static final Logger LOG = Logger.getLogger(Page.class.getName());
  static final String DETAIL_FILE = "page.json";

  private final FileSystem fs;
  private final Path directory;
  private final PageDetail detail;
  private final VersionStore versions;
  private final AttachmentStore attachments;

  Page(FileSystem fs, Path directory, PageDetail detail) {
    this.fs = fs;
    this.directory = directory;
    this.detail = detail;
    this.versions = new VersionStore(fs, directory);
    this.attachments = new AttachmentStore(fs, directory);
  }

  public static Page open(FileSystem fs, Path directory) throws PageException {
    String expectedName = directoryName(directory);
    PageDetail detail;
    try {
      if (!StoreFiles.exists(fs, directory)) {
        throw new PageException(PageException.Kind.NOT_FOUND, "No page at " + directory);
      }
      if (!StoreFiles.isDirectory(fs, directory)) {
        throw new PageException(PageException.Kind.NOT_DIRECTORY, directory + " is not a directory");
      }
      Buffer data = fs.readFileBlocking(directory.resolve(DETAIL_FILE).toString());
      detail = PageDetail.parse(data);
    } catch (FileSystemException e) {
      throw PageException.fromFileSystem("Failed to read page " + directory, e);
    }
    if (!detail.name().equals(expectedName)) {
      throw new PageException(PageException.Kind.NAME_MISMATCH,
        "Page " + directory + " stores detail named " + detail.name());
    }
    return new Page(fs, directory, detail);
  }

  /**
   * Creates the page directory and writes the first version. Fails if the directory exists.
   */
  public void create() throws PageException {
    checkIdentity();
    try {
      if (StoreFiles.exists(fs, directory)) {
        throw new PageException(PageException.Kind.OVERWRITE, "Page " + detail.name() + " already exists");
      }
      fs.mkdirBlocking(directory.toString());
    } catch (FileSystemException e) {
      if (StoreFiles.isAlreadyExists(e)) {
        throw new PageException(PageException.Kind.OVERWRITE, "Page " + detail.name() + " already exists", e);
      }
      throw PageException.fromFileSystem("Failed to create page " + directory, e);
    }
    write();
    LOG.info(() -> "Created page " + directory);
  }

  /**
   * Replaces the current detail of an existing page.
   */
  public void update() throws PageException {
    checkIdentity();
    if (!StoreFiles.isDirectory(fs, directory)) {
      throw new PageException(PageException.Kind.NOT_FOUND, "No page at " + directory);
    }
    write();
  }

  private void write() throws PageException {
    Buffer data = detail.encode();
    try {
      StoreFiles.writeAtomically(fs, directory.resolve(DETAIL_FILE), data, true);
    } catch (FileSystemException e) {
      throw PageException.fromFileSystem("Failed to write page " + directory, e);
    }
    String hash = versions.put(data);
    LOG.fine(() -> "Wrote page " + directory + " at version " + hash);
  }

  public List<VersionStub> listVersions() throws PageException {
    return versions.list();
  }

  public PageDetail getVersion(String hash) throws PageException {
    return PageDetail.parse(versions.get(hash));
  }

  public List<AttachmentStub> listAttachments() throws AttachmentException {
    return attachments.list();
  }

  public Attachment getAttachment(String fileName) throws AttachmentException {
    return attachments.open(fileName);
  }

  public void saveAttachment(AttachmentUpload upload) throws AttachmentException {
    attachments.save(upload);
  }

  public Path directory() {
    return directory;
  }

  public PageDetail detail() {
    return detail;
  }

  private void checkIdentity() throws PageException {
    if (!Names.isPlainSegment(detail.name()) || !detail.name().equals(directoryName(directory))) {
      throw new PageException(PageException.Kind.INVALID_PATH,
        "Page name " + detail.name() + " does not name the directory " + directory);
    }
  }

  private static String directoryName(Path directory) throws PageException {
    Path fileName = directory.getFileName();
    if (fileName == null) {
      throw new PageException(PageException.Kind.INVALID_PATH, "Page path has no name: " + directory);
    }
    String name = fileName.toString();
    // undecodable bytes in a file name come back as replacement characters
    if (name.indexOf('\uFFFD') >= 0) {
      throw new PageException(PageException.Kind.UTF8, "Page directory name is not valid UTF-8: " + directory);
    }
    return name;
  }
}
