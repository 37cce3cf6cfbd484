package biowikiMain;

import biowiki.server.WikiConfig;
import biowiki.server.WikiConfigLoader;
import biowiki.server.WikiServer;
import io.vertx.core.Vertx;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class BiowikiMain {
  private static final Logger LOG = Logger.getLogger(BiowikiMain.class.getName());
  static final String USAGE = String.join(System.lineSeparator(),
    "Usage: biowiki [options]",
    "  -h, --host HOST     listen on host (default: 127.0.0.1)",
    "  -p, --port PORT     listen on port (default: 3000)",
    "  -d, --dir PATH      directory for wiki files (required)",
    "  --config FILE       JSON config file (default: biowiki-config.json)",
    "  --help              print this help menu");
  private static final Map<String, String> SHORT_OPTIONS = Map.of("-h", "host", "-p", "port", "-d", "dir");

  private BiowikiMain() {
  }

  public static void main(String[] args) {
    Map<String, String> params = parseArgs(args);
    if (params.containsKey("help")) {
      System.out.println(USAGE);
      System.exit(0);
    }

    Vertx vertx = Vertx.vertx();
    WikiConfig config;
    try {
      WikiConfig loaded = WikiConfigLoader.load(vertx, WikiConfig.fromEnv(),
        WikiConfigLoader.configFile(params.get("config")));
      config = applyArgs(loaded, params);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.println(USAGE);
      vertx.close();
      System.exit(2);
      return;
    }

    Path dir = Path.of(config.dataDir());
    if (!Files.isDirectory(dir)) {
      System.err.println(dir + " is not a directory");
      vertx.close();
      System.exit(1);
      return;
    }

    new WikiServer(vertx, config).start().onFailure(e -> {
      LOG.log(Level.SEVERE, "Failed to start server on " + config.host() + ":" + config.port(), e);
      vertx.close();
      System.exit(1);
    });
  }

  /**
   * Applies command-line values over {@code config}.
   *
   * @throws IllegalArgumentException for a non-numeric port or when no data directory is configured
   */
  static WikiConfig applyArgs(WikiConfig config, Map<String, String> params) {
    WikiConfig result = config;
    String host = params.get("host");
    if (StringUtils.isNotBlank(host)) {
      result = result.withHost(host);
    }
    String port = params.get("port");
    if (StringUtils.isNotBlank(port)) {
      try {
        result = result.withPort(Integer.parseInt(port));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid port: " + port, e);
      }
    }
    String dir = params.get("dir");
    if (StringUtils.isNotBlank(dir)) {
      result = result.withDataDir(dir);
    }
    if (StringUtils.isBlank(result.dataDir())) {
      throw new IllegalArgumentException("Required option 'dir' missing");
    }
    return result;
  }

  static Map<String, String> parseArgs(String[] args) {
    Map<String, String> params = new HashMap<>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      String key;
      if (arg.startsWith("--")) {
        key = arg.substring(2);
      } else if (SHORT_OPTIONS.containsKey(arg)) {
        key = SHORT_OPTIONS.get(arg);
      } else {
        continue;
      }
      String value = (i + 1 < args.length && !args[i + 1].startsWith("-")) ? args[++i] : "true";
      params.put(key, value);
    }
    return params;
  }
}
