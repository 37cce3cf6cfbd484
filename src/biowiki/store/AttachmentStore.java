package biowiki.store;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.FileSystem;
import io.vertx.core.file.FileSystemException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Raw attachment files under a page's {@code attachments} directory. Attachments have no
 * history: saving an existing name overwrites it.
 */
public final class AttachmentStore {
  private static final Logger LOG = Logger.getLogger(AttachmentStore.class.getName());
  static final String DIRECTORY = "attachments";

  private final FileSystem fs;
  private final Path directory;

  AttachmentStore(FileSystem fs, Path pageDirectory) {
    this.fs = fs;
    this.directory = pageDirectory.resolve(DIRECTORY);
  }

  public List<AttachmentStub> list() throws AttachmentException {
    List<AttachmentStub> stubs = new ArrayList<>();
    try {
      if (!StoreFiles.isDirectory(fs, directory)) {
        return stubs;
      }
      for (String name : StoreFiles.childNames(fs, directory, path -> StoreFiles.isRegularFile(fs, path))) {
        stubs.add(new AttachmentStub(name));
      }
      return stubs;
    } catch (FileSystemException e) {
      throw new AttachmentException(AttachmentException.Kind.IO, "Failed to list attachments in " + directory, e);
    }
  }

  public Attachment open(String fileName) throws AttachmentException {
    if (!Names.isPlainSegment(fileName)) {
      throw new AttachmentException(AttachmentException.Kind.NOT_FOUND, "No attachment " + fileName);
    }
    Path path = directory.resolve(fileName);
    try {
      if (!StoreFiles.isRegularFile(fs, path)) {
        throw new AttachmentException(AttachmentException.Kind.NOT_FOUND, "No attachment " + fileName);
      }
    } catch (FileSystemException e) {
      throw AttachmentException.fromFileSystem("Failed to open attachment " + fileName, e);
    }
    return new Attachment(fs, path);
  }

  /**
   * Decodes and writes an upload, replacing any attachment of the same name. The file name
   * is not validated here.
   */
  public void save(AttachmentUpload upload) throws AttachmentException {
    Buffer data = upload.decode();
    Path target = directory.resolve(upload.fileName());
    try {
      if (!StoreFiles.isDirectory(fs, directory)) {
        fs.mkdirsBlocking(directory.toString());
      }
      fs.writeFileBlocking(target.toString(), data);
    } catch (FileSystemException e) {
      throw new AttachmentException(AttachmentException.Kind.IO, "Failed to write attachment " + upload.fileName(), e);
    }
    LOG.fine(() -> "Saved attachment " + target + " (" + data.length() + " bytes)");
  }
}
