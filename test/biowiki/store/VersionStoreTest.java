package biowiki.store;

import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VersionStoreTest {
  @TempDir
  Path tempDir;

  private Vertx vertx;
  private VersionStore versions;

  @BeforeEach
  void setUp() {
    vertx = Vertx.vertx();
    versions = new VersionStore(vertx.fileSystem(), tempDir);
  }

  @AfterEach
  void tearDown() {
    vertx.close();
  }

  @Test
  void hashIsLowercaseSha256Hex() {
    assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
      VersionStore.hash(Buffer.buffer()));
    assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824",
      VersionStore.hash(Buffer.buffer("hello")));
  }

  @Test
  void identicalContentIsStoredOnce() throws Exception {
    String first = versions.put(Buffer.buffer("D1"));
    String second = versions.put(Buffer.buffer("D1"));

    assertEquals(first, second);
    assertEquals(1, versions.list().size());
    assertTrue(Files.isRegularFile(tempDir.resolve("versions").resolve(first + ".json")));
  }

  @Test
  void distinctContentGetsDistinctFiles() throws Exception {
    String d1 = versions.put(Buffer.buffer("D1"));
    String d2 = versions.put(Buffer.buffer("D2"));
    versions.put(Buffer.buffer("D1"));

    List<VersionStub> listed = versions.list();
    assertEquals(2, listed.size());
    assertTrue(listed.stream().anyMatch(v -> v.hash().equals(d1)));
    assertTrue(listed.stream().anyMatch(v -> v.hash().equals(d2)));
    assertEquals("D2", versions.get(d2).toString());
  }

  @Test
  void listIsEmptyWithoutDirectory() throws Exception {
    assertTrue(versions.list().isEmpty());
    assertFalse(Files.exists(tempDir.resolve("versions")));
  }

  @Test
  void listIgnoresForeignFiles() throws Exception {
    Path dir = Files.createDirectories(tempDir.resolve("versions"));
    Files.writeString(dir.resolve("notes.txt"), "x");
    Files.writeString(dir.resolve("abc.json"), "x");
    String hash = versions.put(Buffer.buffer("D1"));

    assertEquals(List.of(hash), versions.list().stream().map(VersionStub::hash).toList());
  }

  @Test
  void unknownHashIsNotFound() {
    String absent = VersionStore.hash(Buffer.buffer("never written"));

    PageException missing = assertThrows(PageException.class, () -> versions.get(absent));
    assertEquals(PageException.Kind.NOT_FOUND, missing.kind());
    assertFalse(versions.contains(absent));

    PageException traversal = assertThrows(PageException.class, () -> versions.get("../page"));
    assertEquals(PageException.Kind.NOT_FOUND, traversal.kind());
  }
}
