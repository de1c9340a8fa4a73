package com.gentoro.projectkit.loader;

import com.gentoro.projectkit.source.SourcesConfig;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.regex.Pattern;

/**
 * Collects violated constraints while a validator walks a resource. Each rule method records at
 * most one entry, prefixed with the field path (e.g. {@code steps[2].instructions}).
 *
 * <p>Optional values ({@code null}) only fail the {@code required}/{@code notEmpty} rules, so the
 * remaining rules can be chained without null checks.
 */
public final class Violations {
  public static final Pattern SEMVER =
      Pattern.compile(
          "^(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)"
              + "(?:-((?:0|[1-9]\\d*|\\d*[a-zA-Z-][0-9a-zA-Z-]*)"
              + "(?:\\.(?:0|[1-9]\\d*|\\d*[a-zA-Z-][0-9a-zA-Z-]*))*))?"
              + "(?:\\+([0-9a-zA-Z-]+(?:\\.[0-9a-zA-Z-]+)*))?$");

  private final List<String> items = new ArrayList<>();

  /** @return true when the value is present (non-null and, for strings, non-empty). */
  public boolean required(String field, Object value) {
    if (value == null || (value instanceof String s && s.isEmpty())) {
      items.add(field + " is required");
      return false;
    }
    return true;
  }

  /** @return true when the collection or map holds at least one element. */
  public boolean notEmpty(String field, Object value) {
    boolean empty =
        value == null
            || (value instanceof Collection<?> c && c.isEmpty())
            || (value instanceof Map<?, ?> m && m.isEmpty());
    if (empty) {
      items.add(field + " must contain at least one element");
      return false;
    }
    return true;
  }

  /** Length in characters (code points) within {@code [min, max]}; skipped for null. */
  public void length(String field, String value, int min, int max) {
    if (value == null) return;
    int len = value.codePointCount(0, value.length());
    if (len < min) {
      items.add(field + " must be at least " + min + " characters long");
    } else if (len > max) {
      items.add(field + " must be at most " + max + " characters long");
    }
  }

  public void maxLength(String field, String value, int max) {
    length(field, value, 0, max);
  }

  public void matches(String field, String value, Pattern pattern, String description) {
    if (value == null) return;
    if (!pattern.matcher(value).matches()) {
      items.add(field + " must be " + description + ", got '" + value + "'");
    }
  }

  public void semver(String field, String value) {
    matches(field, value, SEMVER, "a semantic version");
  }

  public void oneOf(String field, String value, Set<String> allowed) {
    if (value == null) return;
    if (!allowed.contains(value)) {
      items.add(field + " must be one of " + allowed + ", got '" + value + "'");
    }
  }

  /** An absolute URL: parseable and carrying a scheme. */
  public void url(String field, String value) {
    if (value == null) return;
    try {
      URI uri = new URI(value);
      if (uri.getScheme() == null) {
        items.add(field + " must be an absolute URL, got '" + value + "'");
      }
    } catch (URISyntaxException e) {
      items.add(field + " must be a valid URL, got '" + value + "'");
    }
  }

  /** Apply {@code rule} to each element, passing the indexed field path. Skipped for null. */
  public <E> void each(String field, List<E> values, BiConsumer<String, E> rule) {
    if (values == null) return;
    for (int i = 0; i < values.size(); i++) {
      rule.accept(field + "[" + i + "]", values.get(i));
    }
  }

  /** A configured sources section, when present, lists sources with non-empty URIs. */
  public void sources(String field, SourcesConfig config) {
    if (config == null) return;
    each(
        field + ".sources",
        config.sources(),
        (p, source) -> {
          if (required(p, source)) required(p + ".uri", source.uri());
        });
  }

  public void add(String violation) {
    items.add(violation);
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  public List<String> toList() {
    return List.copyOf(items);
  }
}
