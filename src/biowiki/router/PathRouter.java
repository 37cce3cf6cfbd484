package biowiki.router;

import io.vertx.core.http.HttpMethod;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies a method and path into a {@link Route}.
 *
 * <p>Rules are evaluated in registration order and the first match wins, so more specific
 * shapes must be registered before shorter ones that share a prefix. The rule set is
 * compiled once and never changes afterwards.
 */
public final class PathRouter {
  static final String WEBS = "/webs";
  static final String PAGES = WEBS + "/:" + Route.WEB_NAME + "/pages";
  static final String PAGE = PAGES + "/:" + Route.PAGE_NAME;
  static final String ATTACHMENTS = PAGE + "/attachments";
  static final String ATTACHMENT = ATTACHMENTS + "/:" + Route.ATTACHMENT_NAME;
  static final String VERSIONS = PAGE + "/versions";
  static final String VERSION = VERSIONS + "/:" + Route.VERSION_HASH;

  private final List<Rule> rules;

  private PathRouter(List<Rule> rules) {
    this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
  }

  /**
   * Router for the wiki REST surface.
   */
  public static PathRouter wiki() {
    return builder()
      .add(HttpMethod.GET, WEBS, Route.Kind.LIST_WEBS)
      .add(HttpMethod.GET, PAGES, Route.Kind.LIST_PAGES)
      .add(HttpMethod.GET, PAGE, Route.Kind.SHOW_PAGE)
      .add(HttpMethod.GET, ATTACHMENT, Route.Kind.SERVE_ATTACHMENT)
      .add(HttpMethod.GET, ATTACHMENTS, Route.Kind.LIST_ATTACHMENTS)
      .add(HttpMethod.GET, VERSION, Route.Kind.SHOW_PAGE_VERSION)
      .add(HttpMethod.GET, VERSIONS, Route.Kind.LIST_PAGE_VERSIONS)
      .add(HttpMethod.POST, WEBS, Route.Kind.CREATE_WEB)
      .add(HttpMethod.POST, PAGES, Route.Kind.CREATE_PAGE)
      .add(HttpMethod.POST, ATTACHMENTS, Route.Kind.CREATE_ATTACHMENT)
      .add(HttpMethod.PUT, PAGE, Route.Kind.UPDATE_PAGE)
      .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Route route(HttpMethod method, String path) {
    for (Rule rule : rules) {
      if (!rule.method.equals(method)) {
        continue;
      }
      Optional<Map<String, String>> params = rule.pattern.match(path);
      if (params.isPresent()) {
        return Route.of(rule.kind, params.get());
      }
    }
    return Route.invalid();
  }

  public static final class Builder {
    private final List<Rule> rules = new ArrayList<>();

    private Builder() {
    }

    public Builder add(HttpMethod method, String pattern, Route.Kind kind) {
      if (kind == Route.Kind.INVALID) {
        throw new IllegalArgumentException("INVALID is the fallback route and cannot be registered");
      }
      rules.add(new Rule(method, PathPattern.compile(pattern), kind));
      return this;
    }

    public PathRouter build() {
      return new PathRouter(rules);
    }
  }

  private static final class Rule {
    private final HttpMethod method;
    private final PathPattern pattern;
    private final Route.Kind kind;

    private Rule(HttpMethod method, PathPattern pattern, Route.Kind kind) {
      this.method = method;
      this.pattern = pattern;
      this.kind = kind;
    }
  }
}
