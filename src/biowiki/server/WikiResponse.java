package biowiki.server;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Status, content type and body produced by a route, written back on the event loop.
 */
final class WikiResponse {
  static final String JSON = "application/json";

  private final int status;
  private final String contentType;
  private final Buffer body;

  private WikiResponse(int status, String contentType, Buffer body) {
    this.status = status;
    this.contentType = contentType;
    this.body = body;
  }

  static WikiResponse ok() {
    return new WikiResponse(200, null, Buffer.buffer());
  }

  static WikiResponse json(JsonObject value) {
    return new WikiResponse(200, JSON, value.toBuffer());
  }

  static WikiResponse json(JsonArray value) {
    return new WikiResponse(200, JSON, value.toBuffer());
  }

  static WikiResponse bytes(Buffer data, String contentType) {
    return new WikiResponse(200, contentType, data);
  }

  static WikiResponse error(int status, String message) {
    String encoded = new JsonObject().put("error", message == null ? "" : message).encode();
    return new WikiResponse(status, JSON, Buffer.buffer(encoded));
  }

  int status() {
    return status;
  }

  String contentType() {
    return contentType;
  }

  Buffer body() {
    return body;
  }
}
