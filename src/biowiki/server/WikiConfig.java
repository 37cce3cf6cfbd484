package biowiki.server;

import io.vertx.core.json.JsonObject;
import org.apache.commons.lang3.StringUtils;

public final class WikiConfig {
  static final String DEFAULT_HOST = "127.0.0.1";
  static final int DEFAULT_PORT = 3000;
  static final int DEFAULT_REQUEST_TIMEOUT_MS = 30_000;
  static final int DEFAULT_LOCK_TIMEOUT_MS = 10_000;
  static final long DEFAULT_BODY_LIMIT = 10L * 1024 * 1024;

  private final String host;
  private final int port;
  private final String dataDir;
  private final int requestTimeoutMillis;
  private final int lockTimeoutMillis;
  private final long bodyLimitBytes;

  private WikiConfig(String host, int port, String dataDir,
                     int requestTimeoutMillis, int lockTimeoutMillis, long bodyLimitBytes) {
    this.host = host;
    this.port = port;
    this.dataDir = dataDir;
    this.requestTimeoutMillis = requestTimeoutMillis;
    this.lockTimeoutMillis = lockTimeoutMillis;
    this.bodyLimitBytes = bodyLimitBytes;
  }

  public static WikiConfig defaults() {
    return new WikiConfig(DEFAULT_HOST, DEFAULT_PORT, null,
      DEFAULT_REQUEST_TIMEOUT_MS, DEFAULT_LOCK_TIMEOUT_MS, DEFAULT_BODY_LIMIT);
  }

  public static WikiConfig fromEnv() {
    String host = readString("BIOWIKI_HOST", DEFAULT_HOST);
    int port = readInt("BIOWIKI_PORT", DEFAULT_PORT);
    String dataDir = readString("BIOWIKI_DATA_DIR", null);
    int requestTimeoutMillis = readInt("BIOWIKI_HTTP_TIMEOUT_MS", DEFAULT_REQUEST_TIMEOUT_MS);
    int lockTimeoutMillis = readInt("BIOWIKI_LOCK_TIMEOUT_MS", DEFAULT_LOCK_TIMEOUT_MS);
    long bodyLimitBytes = readLong("BIOWIKI_BODY_LIMIT", DEFAULT_BODY_LIMIT);
    return new WikiConfig(host, port, dataDir, requestTimeoutMillis, lockTimeoutMillis, bodyLimitBytes);
  }

  public static WikiConfig fromJson(JsonObject json, WikiConfig fallback) {
    if (json == null) {
      return fallback;
    }
    String host = json.getString("host", fallback.host());
    int port = json.getInteger("port", fallback.port());
    String dataDir = json.getString("dataDir", fallback.dataDir());
    int requestTimeoutMillis = json.getInteger("requestTimeoutMillis", fallback.requestTimeoutMillis());
    int lockTimeoutMillis = json.getInteger("lockTimeoutMillis", fallback.lockTimeoutMillis());
    long bodyLimitBytes = json.getLong("bodyLimitBytes", fallback.bodyLimitBytes());
    return new WikiConfig(host, port, dataDir, requestTimeoutMillis, lockTimeoutMillis, bodyLimitBytes);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("host", host)
      .put("port", port)
      .put("requestTimeoutMillis", requestTimeoutMillis)
      .put("lockTimeoutMillis", lockTimeoutMillis)
      .put("bodyLimitBytes", bodyLimitBytes);
    if (dataDir != null) {
      json.put("dataDir", dataDir);
    }
    return json;
  }

  public WikiConfig withHost(String host) {
    return new WikiConfig(host, port, dataDir, requestTimeoutMillis, lockTimeoutMillis, bodyLimitBytes);
  }

  public WikiConfig withPort(int port) {
    return new WikiConfig(host, port, dataDir, requestTimeoutMillis, lockTimeoutMillis, bodyLimitBytes);
  }

  public WikiConfig withDataDir(String dataDir) {
    return new WikiConfig(host, port, dataDir, requestTimeoutMillis, lockTimeoutMillis, bodyLimitBytes);
  }

  public String host() {
    return host;
  }

  public int port() {
    return port;
  }

  public String dataDir() {
    return dataDir;
  }

  public int requestTimeoutMillis() {
    return requestTimeoutMillis;
  }

  public int lockTimeoutMillis() {
    return lockTimeoutMillis;
  }

  public long bodyLimitBytes() {
    return bodyLimitBytes;
  }

  private static int readInt(String key, int fallback) {
    String raw = readString(key, null);
    if (raw == null) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      return fallback;
    }
  }

  private static long readLong(String key, long fallback) {
    String raw = readString(key, null);
    if (raw == null) {
      return fallback;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException e) {
      return fallback;
    }
  }

  static String readString(String key, String fallback) {
    String value = System.getProperty(key);
    if (StringUtils.isBlank(value)) {
      value = System.getenv(key);
    }
    return StringUtils.isBlank(value) ? fallback : value;
  }
}
