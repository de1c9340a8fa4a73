package com.gentoro.projectkit;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Command line flags of the form {@code --name value}. A flag directly followed by another flag, or
 * given last, has no value. Arguments that are not flags and unknown flags are ignored.
 */
public class StartupParameters {
  public static final String MODE_UPDATE = "update";
  public static final String MODE_HELP = "help";

  static final String MODE_FLAG = "mode";
  static final String CONFIG_FILE_FLAG = "config-file";
  static final String DEFAULT_CONFIG_FILE = "classpath:application.yaml";

  private static final String FLAG_PREFIX = "--";
  private static final Set<String> MODES = Set.of(MODE_UPDATE, MODE_HELP);

  private final Map<String, String> flags = new LinkedHashMap<>();

  public StartupParameters(String[] arguments) {
    flags.put(MODE_FLAG, MODE_UPDATE);
    flags.put(CONFIG_FILE_FLAG, DEFAULT_CONFIG_FILE);
    parse(arguments);
    validate();
  }

  private void parse(String[] arguments) {
    int i = 0;
    while (i < arguments.length) {
      String arg = arguments[i++];
      if (!arg.startsWith(FLAG_PREFIX)) continue;

      String value = null;
      if (i < arguments.length && !arguments[i].startsWith(FLAG_PREFIX)) {
        value = arguments[i++];
      }
      flags.put(arg.substring(FLAG_PREFIX.length()), value);
    }
  }

  private void validate() {
    String mode = flags.get(MODE_FLAG);
    if (mode == null || !MODES.contains(mode)) {
      throw new IllegalArgumentException("Invalid mode: " + mode + ", expected one of " + MODES);
    }
    String configFile = flags.get(CONFIG_FILE_FLAG);
    if (configFile == null || configFile.isBlank()) {
      throw new IllegalArgumentException("Missing value for --" + CONFIG_FILE_FLAG);
    }
  }

  /** One of {@link #MODE_UPDATE} or {@link #MODE_HELP}. */
  public String mode() {
    return flags.get(MODE_FLAG);
  }

  /**
   * Location of the application configuration, e.g. {@code classpath:application.yaml}, {@code
   * file:/etc/projectkit.yaml} or {@code config/local.yaml}.
   */
  public String configFile() {
    return flags.get(CONFIG_FILE_FLAG);
  }
}
