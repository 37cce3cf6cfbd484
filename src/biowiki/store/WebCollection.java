package biowiki.store;

import io.vertx.core.file.FileSystem;
import io.vertx.core.file.FileSystemException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * All webs of a wiki, one directory each under a root directory.
 */
public final class WebCollection {
  private static final Logger LOG = Logger.getLogger(WebCollection.class.getName());

  private final FileSystem fs;
  private final Path root;

  public WebCollection(FileSystem fs, Path root) {
    this.fs = fs;
    this.root = root;
  }

  public List<WebStub> list() throws WebException {
    List<WebStub> stubs = new ArrayList<>();
    try {
      for (String name : StoreFiles.childNames(fs, root, path -> StoreFiles.isDirectory(fs, path))) {
        stubs.add(new WebStub(name));
      }
      return stubs;
    } catch (FileSystemException e) {
      throw new WebException(WebException.Kind.IO, "Failed to list webs in " + root, e);
    }
  }

  /**
   * The web named {@code name}, if its directory exists.
   */
  public Optional<Web> get(String name) {
    if (!Names.isPlainSegment(name)) {
      return Optional.empty();
    }
    Path directory = root.resolve(name);
    if (!StoreFiles.isDirectory(fs, directory)) {
      return Optional.empty();
    }
    return Optional.of(new Web(fs, name, directory));
  }

  public Web create(String name) throws WebException {
    if (!Names.isPlainSegment(name)) {
      throw new WebException(WebException.Kind.INVALID_NAME, "Invalid web name: " + name);
    }
    Path directory = root.resolve(name);
    try {
      if (StoreFiles.exists(fs, directory)) {
        throw new WebException(WebException.Kind.OVERWRITE, "Web " + name + " already exists");
      }
      fs.mkdirBlocking(directory.toString());
    } catch (FileSystemException e) {
      if (StoreFiles.isAlreadyExists(e)) {
        throw new WebException(WebException.Kind.OVERWRITE, "Web " + name + " already exists", e);
      }
      throw new WebException(WebException.Kind.IO, "Failed to create web " + name, e);
    }
    LOG.info(() -> "Created web " + directory);
    return new Web(fs, name, directory);
  }

  public Path root() {
    return root;
  }
}
