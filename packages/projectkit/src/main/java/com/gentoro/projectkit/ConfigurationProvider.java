package com.gentoro.projectkit;

import com.gentoro.projectkit.exception.ConfigException;
import com.gentoro.projectkit.exception.SerializationException;
import com.gentoro.projectkit.logging.LoggingService;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;
import org.slf4j.Logger;

/**
 * Application configuration backed by Apache Commons Configuration.
 *
 * <p>The location is either {@code classpath:<resource>}, a {@code file:} URI or a plain path. A
 * missing classpath resource yields an empty configuration so every key falls back to its default;
 * a missing file is an error.
 *
 * <p>{@code ${env:NAME}} placeholders resolve against the process environment, then against a
 * {@value #ENV_FILE} file in the working directory.
 */
public final class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  static final String ENV_FILE = ".env.local";
  private static final String CLASSPATH_PREFIX = "classpath:";
  private static final String FILE_PREFIX = "file:";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    YAMLConfiguration yaml = load(location == null ? "" : location.trim());
    yaml.getInterpolator().registerLookup("env", new EnvLookup(Path.of(ENV_FILE)));
    this.configuration = yaml;
  }

  public Configuration config() {
    return configuration;
  }

  private static YAMLConfiguration load(String location) {
    if (location.isEmpty()) {
      return fromClasspath("application.yaml");
    }
    if (location.startsWith(CLASSPATH_PREFIX)) {
      return fromClasspath(location.substring(CLASSPATH_PREFIX.length()));
    }
    if (location.regionMatches(true, 0, FILE_PREFIX, 0, FILE_PREFIX.length())) {
      File file;
      try {
        file = new File(URI.create(location));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Invalid configuration location: " + location, e);
      }
      return fromFile(file);
    }
    return fromFile(new File(location));
  }

  private static YAMLConfiguration fromClasspath(String resource) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    InputStream input = loader.getResourceAsStream(resource);
    if (input == null) {
      log.debug("Classpath resource {} not found, using defaults", resource);
      return yaml;
    }
    try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
      yaml.read(reader);
      log.debug("Loaded configuration from classpath resource {}", resource);
      return yaml;
    } catch (IOException | ConfigurationException e) {
      throw new SerializationException(
          "Failed to read YAML from classpath resource: " + resource, e);
    }
  }

  private static YAMLConfiguration fromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file not found: " + file.getAbsolutePath());
    }
    FileBasedConfigurationBuilder<YAMLConfiguration> builder =
        new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
            .configure(new Parameters().fileBased().setFile(file));
    try {
      YAMLConfiguration yaml = builder.getConfiguration();
      log.debug("Loaded configuration from {}", file.getAbsolutePath());
      return yaml;
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  /**
   * Resolves environment variables, falling back to {@code KEY=value} lines of an env file. The
   * file is read once, on the first lookup the environment cannot answer.
   */
  static final class EnvLookup implements Lookup {
    private final Path envFile;
    private Map<String, String> fileValues;

    EnvLookup(Path envFile) {
      this.envFile = envFile;
    }

    @Override
    public Object lookup(String key) {
      String value = System.getenv(key);
      if (value != null && !value.isEmpty()) return value;
      return fileValues().get(key);
    }

    private synchronized Map<String, String> fileValues() {
      if (fileValues == null) {
        fileValues = Files.isRegularFile(envFile) ? parse(readLines()) : Map.of();
      }
      return fileValues;
    }

    private List<String> readLines() {
      log.debug("Reading environment fallback {}", envFile.toAbsolutePath());
      try {
        return Files.readAllLines(envFile, StandardCharsets.UTF_8);
      } catch (IOException e) {
        throw new ConfigException("Failed to read " + envFile.toAbsolutePath(), e);
      }
    }

    static Map<String, String> parse(List<String> lines) {
      Map<String, String> values = new HashMap<>();
      for (String raw : lines) {
        String line = raw.trim();
        if (line.isEmpty() || line.startsWith("#")) continue;
        int eq = line.indexOf('=');
        if (eq <= 0) continue;
        values.put(line.substring(0, eq).trim(), unquote(line.substring(eq + 1).trim()));
      }
      return values;
    }

    private static String unquote(String value) {
      if (value.length() < 2) return value;
      char first = value.charAt(0);
      if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
        return value.substring(1, value.length() - 1);
      }
      return value;
    }
  }
}
