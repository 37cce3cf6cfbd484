package biowiki.router;

import java.util.Map;

/**
 * Result of classifying a request: what to do and which web, page, attachment or
 * version it targets. Parameters a route kind does not use are {@code null}.
 */
public final class Route {
  public enum Kind {
    LIST_WEBS,
    CREATE_WEB,
    LIST_PAGES,
    CREATE_PAGE,
    SHOW_PAGE,
    UPDATE_PAGE,
    LIST_ATTACHMENTS,
    CREATE_ATTACHMENT,
    SERVE_ATTACHMENT,
    LIST_PAGE_VERSIONS,
    SHOW_PAGE_VERSION,
    INVALID
  }

  static final String WEB_NAME = "web_name";
  static final String PAGE_NAME = "page_name";
  static final String ATTACHMENT_NAME = "attachment_name";
  static final String VERSION_HASH = "version_hash";

  private static final Route INVALID = new Route(Kind.INVALID, null, null, null, null);

  private final Kind kind;
  private final String webName;
  private final String pageName;
  private final String attachmentName;
  private final String versionHash;

  private Route(Kind kind, String webName, String pageName, String attachmentName, String versionHash) {
    this.kind = kind;
    this.webName = webName;
    this.pageName = pageName;
    this.attachmentName = attachmentName;
    this.versionHash = versionHash;
  }

  static Route of(Kind kind, Map<String, String> params) {
    return new Route(kind,
      params.get(WEB_NAME),
      params.get(PAGE_NAME),
      params.get(ATTACHMENT_NAME),
      params.get(VERSION_HASH));
  }

  public static Route invalid() {
    return INVALID;
  }

  public Kind kind() {
    return kind;
  }

  public boolean isValid() {
    return kind != Kind.INVALID;
  }

  public String webName() {
    return webName;
  }

  public String pageName() {
    return pageName;
  }

  public String attachmentName() {
    return attachmentName;
  }

  public String versionHash() {
    return versionHash;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder(kind.name());
    if (webName != null) {
      builder.append(" web=").append(webName);
    }
    if (pageName != null) {
      builder.append(" page=").append(pageName);
    }
    if (attachmentName != null) {
      builder.append(" attachment=").append(attachmentName);
    }
    if (versionHash != null) {
      builder.append(" version=").append(versionHash);
    }
    return builder.toString();
  }
}
