package com.gentoro.projectkit.utility;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only copies for record components. Unlike {@link List#copyOf} these keep {@code null}
 * (absent in YAML) and {@code null} elements, which the validators report instead of failing
 * during binding.
 */
public final class CollectionUtility {
  private CollectionUtility() {}

  public static <T> List<T> immutableList(List<T> list) {
    if (list == null) return null;
    return Collections.unmodifiableList(new ArrayList<>(list));
  }

  /** Copies preserving iteration order. */
  public static <K, V> Map<K, V> immutableMap(Map<K, V> map) {
    if (map == null) return null;
    return Collections.unmodifiableMap(new LinkedHashMap<>(map));
  }
}
