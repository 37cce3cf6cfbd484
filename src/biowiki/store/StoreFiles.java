package biowiki.store;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.CopyOptions;
import io.vertx.core.file.FileProps;
import io.vertx.core.file.FileSystem;
import io.vertx.core.file.FileSystemException;

import java.io.FileNotFoundException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Blocking filesystem helpers shared by the stores.
 */
final class StoreFiles {
  private static final String TEMP_SUFFIX = ".tmp";
  private static final long MOVE_TIMEOUT_SECONDS = 30;

  private StoreFiles() {
  }

  static boolean exists(FileSystem fs, Path path) {
    return fs.existsBlocking(path.toString());
  }

  static boolean isDirectory(FileSystem fs, Path path) {
    FileProps props = props(fs, path);
    return props != null && props.isDirectory();
  }

  static boolean isRegularFile(FileSystem fs, Path path) {
    FileProps props = props(fs, path);
    return props != null && props.isRegularFile();
  }

  /**
   * Names of the direct children of {@code directory} accepted by {@code filter}, sorted.
   */
  static List<String> childNames(FileSystem fs, Path directory, Predicate<Path> filter) {
    List<String> names = new ArrayList<>();
    for (String child : fs.readDirBlocking(directory.toString())) {
      Path path = Path.of(child);
      if (filter.test(path)) {
        names.add(path.getFileName().toString());
      }
    }
    Collections.sort(names);
    return names;
  }

  /**
   * Writes {@code data} to a temporary sibling and moves it onto {@code target}, so readers
   * see either the previous file or the complete new one.
   *
   * @return false when {@code replace} is off and the target already existed
   */
  static boolean writeAtomically(FileSystem fs, Path target, Buffer data, boolean replace) {
    Path temp = target.resolveSibling("." + target.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
    fs.writeFileBlocking(temp.toString(), data);
    try {
      move(fs, temp, target, new CopyOptions().setReplaceExisting(replace).setAtomicMove(true));
      return true;
    } catch (FileSystemException e) {
      discard(fs, temp, e);
      if (!replace && isAlreadyExists(e)) {
        return false;
      }
      throw e;
    }
  }

  /**
   * Moves {@code source} onto {@code target} with {@code options} and waits for the result.
   * {@link FileSystem} only takes copy options on the asynchronous move, so this must not run
   * on an event loop thread.
   */
  static void move(FileSystem fs, Path source, Path target, CopyOptions options) {
    try {
      fs.move(source.toString(), target.toString(), options)
        .toCompletionStage()
        .toCompletableFuture()
        .get(MOVE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof FileSystemException) {
        throw (FileSystemException) cause;
      }
      throw new FileSystemException("Failed to move " + source + " to " + target, cause);
    } catch (TimeoutException e) {
      throw new FileSystemException("Timed out moving " + source + " to " + target, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FileSystemException("Interrupted moving " + source + " to " + target, e);
    }
  }

  static boolean isNotFound(Throwable error) {
    for (Throwable current = error; current != null; current = current.getCause()) {
      if (current instanceof NoSuchFileException || current instanceof FileNotFoundException) {
        return true;
      }
    }
    return false;
  }

  static boolean isAlreadyExists(Throwable error) {
    for (Throwable current = error; current != null; current = current.getCause()) {
      if (current instanceof FileAlreadyExistsException) {
        return true;
      }
    }
    return false;
  }

  private static FileProps props(FileSystem fs, Path path) {
    if (!fs.existsBlocking(path.toString())) {
      return null;
    }
    return fs.propsBlocking(path.toString());
  }

  private static void discard(FileSystem fs, Path temp, FileSystemException failure) {
    try {
      fs.deleteBlocking(temp.toString());
    } catch (FileSystemException e) {
      failure.addSuppressed(e);
    }
  }
}
