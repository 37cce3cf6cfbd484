package biowiki.store;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.FileSystem;
import io.vertx.core.file.FileSystemException;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * An attachment file that was found on disk. Contents are read on demand.
 */
public final class Attachment {
  // anything with a non-empty stem and extension, as files already stored may be named
  private static final Pattern STORED_NAME = Pattern.compile("^.+\\..+$");

  private final FileSystem fs;
  private final Path path;

  Attachment(FileSystem fs, Path path) {
    this.fs = fs;
    this.path = path;
  }

  public static boolean isStoredNameValid(String fileName) {
    return fileName != null && STORED_NAME.matcher(fileName).matches();
  }

  public String fileName() {
    return path.getFileName().toString();
  }

  /**
   * Reads the whole file into memory.
   */
  public Buffer data() throws AttachmentException {
    try {
      return fs.readFileBlocking(path.toString());
    } catch (FileSystemException e) {
      throw AttachmentException.fromFileSystem("Failed to read attachment " + fileName(), e);
    }
  }

  public MimeType mimeType() {
    return MimeType.forFileName(fileName());
  }
}
