package biowiki.server;

import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads the optional JSON config file and merges it over env-derived defaults.
 */
public final class WikiConfigLoader {
  private static final Logger LOG = Logger.getLogger(WikiConfigLoader.class.getName());
  static final String DEFAULT_CONFIG_FILE = "biowiki-config.json";
  private static final long LOAD_TIMEOUT_SECONDS = 5;

  private WikiConfigLoader() {
  }

  public static String configFile(String explicit) {
    if (explicit != null && !explicit.isEmpty()) {
      return explicit;
    }
    return WikiConfig.readString("BIOWIKI_CONFIG", DEFAULT_CONFIG_FILE);
  }

  public static WikiConfig load(Vertx vertx, WikiConfig fallback, String path) {
    ConfigStoreOptions fileStore = new ConfigStoreOptions()
      .setType("file")
      .setFormat("json")
      .setOptional(true)
      .setConfig(new JsonObject().put("path", path));

    ConfigRetrieverOptions options = new ConfigRetrieverOptions()
      .setIncludeDefaultStores(false)
      .addStore(fileStore);

    ConfigRetriever retriever = ConfigRetriever.create(vertx, options);
    try {
      JsonObject loaded = retriever.getConfig()
        .toCompletionStage()
        .toCompletableFuture()
        .get(LOAD_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      return WikiConfig.fromJson(loaded, fallback);
    } catch (ExecutionException | TimeoutException e) {
      LOG.log(Level.WARNING, "Could not read config file " + path + ", using defaults", e);
      return fallback;
    } catch (ClassCastException e) {
      LOG.log(Level.WARNING, "Config file " + path + " has a value of the wrong type, using defaults", e);
      return fallback;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return fallback;
    } finally {
      retriever.close();
    }
  }
}
