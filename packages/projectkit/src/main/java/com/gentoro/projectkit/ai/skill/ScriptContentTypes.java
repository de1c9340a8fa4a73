package com.gentoro.projectkit.ai.skill;

import com.gentoro.projectkit.fs.SourcePaths;
import java.util.Locale;
import java.util.Map;

/** Maps script file extensions to content types. */
public final class ScriptContentTypes {
  public static final String DEFAULT = "application/octet-stream";

  private static final Map<String, String> BY_EXTENSION =
      Map.ofEntries(
          Map.entry(".sh", "application/x-sh"),
          Map.entry(".bash", "application/x-sh"),
          Map.entry(".zsh", "application/x-sh"),
          Map.entry(".ksh", "application/x-sh"),
          Map.entry(".csh", "application/x-csh"),
          Map.entry(".fish", "application/x-fish"),
          Map.entry(".py", "text/x-python"),
          Map.entry(".rb", "text/x-ruby"),
          Map.entry(".pl", "text/x-perl"),
          Map.entry(".lua", "text/x-lua"),
          Map.entry(".js", "text/javascript"),
          Map.entry(".awk", "text/x-awk"),
          Map.entry(".sed", "text/x-sed"),
          Map.entry(".tcl", "application/x-tcl"));

  private ScriptContentTypes() {}

  public static String forFileName(String fileName) {
    String ext = SourcePaths.extension(fileName).toLowerCase(Locale.ROOT);
    return BY_EXTENSION.getOrDefault(ext, DEFAULT);
  }
}
