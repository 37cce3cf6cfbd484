package biowiki.store;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.FileSystem;
import io.vertx.core.file.FileSystemException;

import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Append-only, content-addressed snapshots of a page.
 *
 * <p>Each value is stored once under {@code <sha256-hex>.json}. A key that already exists is
 * never rewritten, so putting the same bytes again is a no-op and an observed version file
 * never changes.
 */
public final class VersionStore {
  static final String DIRECTORY = "versions";
  private static final String EXTENSION = ".json";
  private static final String DIGEST = "SHA-256";
  private static final Pattern HASH = Pattern.compile("^[0-9a-f]{64}$");

  private final FileSystem fs;
  private final Path directory;

  VersionStore(FileSystem fs, Path pageDirectory) {
    this.fs = fs;
    this.directory = pageDirectory.resolve(DIRECTORY);
  }

  /**
   * Lowercase hex SHA-256 of {@code data}.
   */
  public static String hash(Buffer data) {
    try {
      MessageDigest digest = MessageDigest.getInstance(DIGEST);
      return HexFormat.of().formatHex(digest.digest(data.getBytes()));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(DIGEST + " is not available", e);
    }
  }

  /**
   * Stores {@code data} under its hash unless a version with that hash exists.
   *
   * @return the hash identifying the stored bytes
   */
  public String put(Buffer data) throws PageException {
    String hash = hash(data);
    Path target = pathFor(hash);
    try {
      if (StoreFiles.exists(fs, target)) {
        return hash;
      }
      if (!StoreFiles.isDirectory(fs, directory)) {
        fs.mkdirsBlocking(directory.toString());
      }
      StoreFiles.writeAtomically(fs, target, data, false);
      return hash;
    } catch (FileSystemException e) {
      throw new PageException(PageException.Kind.IO, "Failed to write version " + hash, e);
    }
  }

  boolean contains(String hash) {
    return isHash(hash) && StoreFiles.isRegularFile(fs, pathFor(hash));
  }

  public Buffer get(String hash) throws PageException {
    if (!isHash(hash)) {
      throw new PageException(PageException.Kind.NOT_FOUND, "No version " + hash);
    }
    try {
      return fs.readFileBlocking(pathFor(hash).toString());
    } catch (FileSystemException e) {
      throw PageException.fromFileSystem("Failed to read version " + hash, e);
    }
  }

  /**
   * One stub per stored version, sorted by hash. Empty when nothing was written yet.
   */
  public List<VersionStub> list() throws PageException {
    List<VersionStub> stubs = new ArrayList<>();
    try {
      if (!StoreFiles.isDirectory(fs, directory)) {
        return stubs;
      }
      List<String> names = StoreFiles.childNames(fs, directory,
        path -> path.getFileName().toString().endsWith(EXTENSION) && StoreFiles.isRegularFile(fs, path));
      for (String name : names) {
        String hash = name.substring(0, name.length() - EXTENSION.length());
        if (isHash(hash)) {
          stubs.add(new VersionStub(hash));
        }
      }
      return stubs;
    } catch (FileSystemException e) {
      throw new PageException(PageException.Kind.IO, "Failed to list versions in " + directory, e);
    }
  }

  private Path pathFor(String hash) {
    return directory.resolve(hash + EXTENSION);
  }

  private static boolean isHash(String value) {
    return value != null && HASH.matcher(value).matches();
  }
}
