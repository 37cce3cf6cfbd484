package biowikiMain;

import biowiki.server.WikiConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BiowikiMainTest {
  @Test
  void parsesLongAndShortOptions() {
    Map<String, String> params = BiowikiMain.parseArgs(
      new String[] {"-h", "0.0.0.0", "--port", "8080", "-d", "/srv/wiki", "--help"});

    assertEquals("0.0.0.0", params.get("host"));
    assertEquals("8080", params.get("port"));
    assertEquals("/srv/wiki", params.get("dir"));
    assertEquals("true", params.get("help"));
  }

  @Test
  void ignoresStrayArguments() {
    Map<String, String> params = BiowikiMain.parseArgs(new String[] {"stray", "-x", "--dir", "/wiki"});

    assertEquals(Map.of("dir", "/wiki"), params);
  }

  @Test
  void argumentsOverrideConfig() {
    WikiConfig config = BiowikiMain.applyArgs(WikiConfig.defaults().withDataDir("/from/file"),
      Map.of("port", "4000", "dir", "/from/cli"));

    assertEquals(4000, config.port());
    assertEquals("/from/cli", config.dataDir());
    assertEquals("127.0.0.1", config.host());
  }

  @Test
  void dataDirectoryIsRequired() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
      () -> BiowikiMain.applyArgs(WikiConfig.defaults(), Map.of()));

    assertTrue(e.getMessage().contains("dir"));
  }

  @Test
  void portMustBeNumeric() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
      () -> BiowikiMain.applyArgs(WikiConfig.defaults().withDataDir("/wiki"), Map.of("port", "http")));

    assertEquals("Invalid port: http", e.getMessage());
  }
}
