package biowiki.router;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A compiled path pattern made of literal segments and {@code :name} placeholders,
 * e.g. {@code /webs/:web_name/pages}.
 *
 * <p>Each placeholder matches exactly one non-empty path component. Instances are immutable
 * and can be shared between threads.
 */
public final class PathPattern {
  private static final String PARAM_PREFIX = ":";
  private static final String SEGMENT = "([^/]+)";

  private final String source;
  private final List<String> names;
  private final Pattern regex;

  private PathPattern(String source, List<String> names, Pattern regex) {
    this.source = source;
    this.names = names;
    this.regex = regex;
  }

  public static PathPattern compile(String pattern) {
    if (pattern == null || !pattern.startsWith("/")) {
      throw new IllegalArgumentException("Path pattern must start with '/': " + pattern);
    }
    List<String> names = new ArrayList<>();
    StringBuilder expression = new StringBuilder("^");
    String[] parts = pattern.substring(1).split("/", -1);
    for (String part : parts) {
      expression.append('/');
      if (part.startsWith(PARAM_PREFIX) && part.length() > PARAM_PREFIX.length()) {
        names.add(part.substring(PARAM_PREFIX.length()));
        expression.append(SEGMENT);
      } else if (!part.isEmpty()) {
        expression.append(Pattern.quote(part));
      }
    }
    expression.append('$');
    return new PathPattern(pattern, Collections.unmodifiableList(names), Pattern.compile(expression.toString()));
  }

  /**
   * Matches a concrete path against this pattern.
   *
   * @return the captured parameters in declaration order, or empty when the path does not match
   */
  public Optional<Map<String, String>> match(String path) {
    if (path == null) {
      return Optional.empty();
    }
    Matcher matcher = regex.matcher(path);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    Map<String, String> params = new LinkedHashMap<>();
    for (int i = 0; i < names.size(); i++) {
      params.putIfAbsent(names.get(i), matcher.group(i + 1));
    }
    // a repeated name would silently drop a capture
    if (params.size() != names.size()) {
      return Optional.empty();
    }
    return Optional.of(params);
  }

  @Override
  public String toString() {
    return source;
  }
}
