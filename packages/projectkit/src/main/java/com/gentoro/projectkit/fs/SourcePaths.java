package com.gentoro.projectkit.fs;

import java.util.ArrayDeque;
import java.util.Deque;

/** Helpers for the {@code /}-separated paths used by {@link SourceFs}. */
public final class SourcePaths {
  public static final String ROOT = ".";

  private SourcePaths() {}

  /**
   * Lexically normalize a path: collapses repeated separators, removes {@code .} segments and
   * resolves {@code ..} against the preceding segment. An absolute path never climbs above {@code
   * /}; a relative path keeps leading {@code ..} segments. The empty path cleans to {@code "."}.
   */
  public static String clean(String path) {
    if (path == null || path.isEmpty()) return ROOT;
    String normalized = path.replace('\\', '/');
    boolean absolute = normalized.startsWith("/");

    Deque<String> segments = new ArrayDeque<>();
    for (String segment : normalized.split("/")) {
      if (segment.isEmpty() || segment.equals(".")) continue;
      if (segment.equals("..")) {
        if (!segments.isEmpty() && !segments.peekLast().equals("..")) {
          segments.removeLast();
        } else if (!absolute) {
          segments.addLast("..");
        }
        continue;
      }
      segments.addLast(segment);
    }

    String joined = String.join("/", segments);
    if (absolute) return "/" + joined;
    return joined.isEmpty() ? ROOT : joined;
  }

  /** Join two paths and clean the result. */
  public static String join(String base, String child) {
    String cleanBase = clean(base);
    String cleanChild = clean(child);
    if (cleanChild.equals(ROOT)) return cleanBase;
    if (cleanBase.equals(ROOT)) return cleanChild;
    return clean(cleanBase + "/" + cleanChild);
  }

  /** @return true when the cleaned relative path climbs above its root. */
  public static boolean escapesRoot(String relative) {
    String cleaned = clean(relative);
    return cleaned.equals("..") || cleaned.startsWith("../");
  }

  /** @return the last segment of the path. */
  public static String fileName(String path) {
    String cleaned = clean(path);
    int idx = cleaned.lastIndexOf('/');
    return idx < 0 ? cleaned : cleaned.substring(idx + 1);
  }

  /** @return the extension of the last segment including the dot, or an empty string. */
  public static String extension(String path) {
    String name = fileName(path);
    int idx = name.lastIndexOf('.');
    return idx < 0 ? "" : name.substring(idx);
  }
}
