package biowiki.server;

import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class WikiConfigTest {
  @TempDir
  public Path tempDir;

  @Test
  public void defaultsMatchDocumentedValues() {
    WikiConfig config = WikiConfig.defaults();

    assertEquals("127.0.0.1", config.host());
    assertEquals(3000, config.port());
    assertNull(config.dataDir());
    assertEquals(30_000, config.requestTimeoutMillis());
    assertEquals(10_000, config.lockTimeoutMillis());
    assertEquals(10L * 1024 * 1024, config.bodyLimitBytes());
  }

  @Test
  public void jsonOverridesOnlyPresentKeys() {
    WikiConfig fallback = WikiConfig.defaults().withDataDir("/srv/wiki");
    WikiConfig config = WikiConfig.fromJson(new JsonObject().put("port", 8080).put("lockTimeoutMillis", 50), fallback);

    assertEquals(8080, config.port());
    assertEquals(50, config.lockTimeoutMillis());
    assertEquals("127.0.0.1", config.host());
    assertEquals("/srv/wiki", config.dataDir());
    assertEquals(config.toJson(), WikiConfig.fromJson(config.toJson(), WikiConfig.defaults()).toJson());
  }

  @Test
  public void systemPropertyIsReadBeforeEnvironment() {
    System.setProperty("BIOWIKI_PORT", "4567");
    try {
      assertEquals(4567, WikiConfig.fromEnv().port());
    } finally {
      System.clearProperty("BIOWIKI_PORT");
    }
  }

  @Test
  public void loaderMergesConfigFile() throws Exception {
    Path file = tempDir.resolve("biowiki-config.json");
    Files.writeString(file, new JsonObject().put("host", "0.0.0.0").put("dataDir", "/data").encode(),
      StandardCharsets.UTF_8);
    Vertx vertx = Vertx.vertx();
    try {
      WikiConfig config = WikiConfigLoader.load(vertx, WikiConfig.defaults(), file.toString());

      assertEquals("0.0.0.0", config.host());
      assertEquals("/data", config.dataDir());
      assertEquals(3000, config.port());
    } finally {
      vertx.close();
    }
  }

  @Test
  public void missingConfigFileKeepsFallback() {
    Vertx vertx = Vertx.vertx();
    try {
      WikiConfig fallback = WikiConfig.defaults().withPort(9999);
      WikiConfig config = WikiConfigLoader.load(vertx, fallback, tempDir.resolve("absent.json").toString());

      assertEquals(9999, config.port());
    } finally {
      vertx.close();
    }
  }

  @Test
  public void explicitConfigFileWins() {
    assertEquals("custom.json", WikiConfigLoader.configFile("custom.json"));
  }

  @Test
  public void mistypedConfigValueKeepsFallback() throws Exception {
    Path file = tempDir.resolve("typed.json");
    Files.writeString(file, "{\"port\": \"3000\", \"dataDir\": \"/data\"}", StandardCharsets.UTF_8);
    Vertx vertx = Vertx.vertx();
    try {
      WikiConfig fallback = WikiConfig.defaults().withPort(9999);
      WikiConfig config = WikiConfigLoader.load(vertx, fallback, file.toString());

      assertEquals(9999, config.port());
      assertNull(config.dataDir());
    } finally {
      vertx.close();
    }
  }
}
