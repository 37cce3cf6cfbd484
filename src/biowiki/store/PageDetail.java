package biowiki.store;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonObject;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * The versionable content of a page. Immutable.
 */
public final class PageDetail {
  static final String NAME = "name";
  static final String TITLE = "title";
  static final String CONTENT = "content";
  static final String PARENT = "parent";

  private final String name;
  private final String title;
  private final String content;
  private final String parent;

  public PageDetail(String name, String title, String content) {
    this(name, title, content, null);
  }

  public PageDetail(String name, String title, String content, String parent) {
    this.name = Objects.requireNonNull(name, NAME);
    this.title = Objects.requireNonNull(title, TITLE);
    this.content = Objects.requireNonNull(content, CONTENT);
    this.parent = parent;
  }

  /**
   * Parses a JSON object with required {@code name}, {@code title} and {@code content}
   * strings and an optional {@code parent} string.
   */
  public static PageDetail parse(Buffer data) throws PageException {
    if (data == null || data.length() == 0) {
      throw new PageException(PageException.Kind.SERIALIZATION, "Page detail is empty");
    }
    Object value;
    try {
      value = Json.decodeValue(data);
    } catch (DecodeException e) {
      throw new PageException(PageException.Kind.SERIALIZATION, "Page detail is not valid JSON", e);
    }
    if (!(value instanceof JsonObject)) {
      throw new PageException(PageException.Kind.SERIALIZATION, "Page detail is not a JSON object");
    }
    return fromJson((JsonObject) value);
  }

  static PageDetail fromJson(JsonObject json) throws PageException {
    Object name = json.getValue(NAME);
    Object title = json.getValue(TITLE);
    Object content = json.getValue(CONTENT);
    if (!(name instanceof String) || !(title instanceof String) || !(content instanceof String)) {
      throw new PageException(PageException.Kind.SERIALIZATION,
        "Page detail requires string name, title and content");
    }
    Object parent = json.getValue(PARENT);
    if (parent != null && !(parent instanceof String)) {
      throw new PageException(PageException.Kind.SERIALIZATION, "Page parent must be a string");
    }
    return new PageDetail((String) name, (String) title, (String) content, (String) parent);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put(NAME, name)
      .put(TITLE, title)
      .put(CONTENT, content);
    if (parent != null) {
      json.put(PARENT, parent);
    }
    return json;
  }

  /**
   * The exact bytes that are stored and hashed for this detail.
   */
  public Buffer encode() {
    return Buffer.buffer(toJson().encodePrettily(), StandardCharsets.UTF_8.name());
  }

  public String name() {
    return name;
  }

  public String title() {
    return title;
  }

  public String content() {
    return content;
  }

  public String parent() {
    return parent;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PageDetail)) {
      return false;
    }
    PageDetail other = (PageDetail) o;
    return name.equals(other.name)
      && title.equals(other.title)
      && content.equals(other.content)
      && Objects.equals(parent, other.parent);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, title, content, parent);
  }

  @Override
  public String toString() {
    return "PageDetail{name=" + name + ", title=" + title + "}";
  }
}
