package biowiki.store;

import io.vertx.core.file.FileSystem;
import io.vertx.core.file.FileSystemException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A named collection of pages stored as subdirectories of one directory.
 */
public final class Web {
  private final FileSystem fs;
  private final String name;
  private final Path directory;

  Web(FileSystem fs, String name, Path directory) {
    this.fs = fs;
    this.name = name;
    this.directory = directory;
  }

  public List<PageStub> listPages() throws PageException {
    List<PageStub> stubs = new ArrayList<>();
    try {
      for (String page : StoreFiles.childNames(fs, directory, path -> StoreFiles.isDirectory(fs, path))) {
        stubs.add(new PageStub(page));
      }
      return stubs;
    } catch (FileSystemException e) {
      throw PageException.fromFileSystem("Failed to list pages of web " + name, e);
    }
  }

  public Page openPage(String pageName) throws PageException {
    if (!Names.isPlainSegment(pageName)) {
      throw new PageException(PageException.Kind.NOT_FOUND, "No page " + pageName + " in web " + name);
    }
    return Page.open(fs, directory.resolve(pageName));
  }

  /**
   * Binds {@code detail} to a page directory in this web without touching the disk.
   * Call {@link Page#create()} to persist it.
   */
  public Page newPage(PageDetail detail) {
    return new Page(fs, directory.resolve(detail.name()), detail);
  }

  public String name() {
    return name;
  }
}
