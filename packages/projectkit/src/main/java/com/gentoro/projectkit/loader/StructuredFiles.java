package com.gentoro.projectkit.loader;

import com.gentoro.projectkit.fs.SourcePaths;
import java.util.Locale;
import java.util.Set;

/** Recognizes structured resource files by extension. */
public final class StructuredFiles {
  private static final Set<String> YAML_EXTENSIONS = Set.of(".yaml", ".yml");

  private StructuredFiles() {}

  /** @return true for {@code .yaml} and {@code .yml} files, regardless of case. */
  public static boolean isYaml(String fileName) {
    return YAML_EXTENSIONS.contains(SourcePaths.extension(fileName).toLowerCase(Locale.ROOT));
  }
}
