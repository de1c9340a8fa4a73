package com.gentoro.projectkit.project;

import com.gentoro.projectkit.exception.ConfigException;
import com.gentoro.projectkit.exception.ProjectKitErrorCode;
import com.gentoro.projectkit.exception.ProjectKitException;
import com.gentoro.projectkit.fs.LocalSourceFs;
import com.gentoro.projectkit.fs.SourceFs;
import com.gentoro.projectkit.fs.SourcePaths;
import com.gentoro.projectkit.loader.Violations;
import com.gentoro.projectkit.logging.LoggingService;
import com.gentoro.projectkit.utility.JacksonUtility;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * Discovers and merges {@code .projectkit.yaml} files.
 *
 * <p>The user home directory is consulted first, then the working directory; when both point to
 * the same file it is read once. Source lists of the files found are concatenated in that order.
 */
public class ProjectConfigLoader {
  private static final Logger log = LoggingService.getLogger(ProjectConfigLoader.class);

  public static final String CONFIG_FILE_NAME = ".projectkit.yaml";

  private final SourceFs fs;
  private final String homeDir;
  private final String workDir;

  /** Loader reading the local disk, using the JVM's home and working directories. */
  public ProjectConfigLoader() {
    this(
        LocalSourceFs.workingDirectory(),
        System.getProperty("user.home"),
        LocalSourceFs.workingDirectory().root().toString());
  }

  /**
   * @param fs filesystem the directories below are resolved against
   * @param homeDir user home directory; skipped when null
   * @param workDir working directory; skipped when null
   */
  public ProjectConfigLoader(SourceFs fs, String homeDir, String workDir) {
    this.fs = Objects.requireNonNull(fs, "fs");
    this.homeDir = homeDir;
    this.workDir = workDir;
  }

  public ProjectConfig load() {
    ProjectConfig result = ProjectConfig.empty();
    for (String path : resolvePaths()) {
      ProjectConfig config = loadFile(path);
      validate(config, path);
      result = result.merge(config);
      log.debug("Merged project configuration from {}", path);
    }
    return result;
  }

  List<String> resolvePaths() {
    List<String> paths = new ArrayList<>();
    for (String dir : new String[] {homeDir, workDir}) {
      if (dir == null || dir.isBlank()) continue;
      String candidate = SourcePaths.join(dir, CONFIG_FILE_NAME);
      if (!paths.contains(candidate) && exists(candidate)) {
        paths.add(candidate);
      }
    }
    if (paths.isEmpty()) {
      throw new ConfigException(
          ProjectKitErrorCode.CONFIG_NOT_FOUND,
          "No " + CONFIG_FILE_NAME + " found in home or working directory",
          Map.of("home", String.valueOf(homeDir), "workDir", String.valueOf(workDir)),
          null);
    }
    return paths;
  }

  private boolean exists(String path) {
    try {
      return fs.exists(path);
    } catch (ProjectKitException e) {
      throw new ConfigException(
          ProjectKitErrorCode.CONFIG_LOAD_FAILED,
          "Failed to check " + path + ": " + e.getMessage(),
          Map.of("path", path),
          e);
    }
  }

  private ProjectConfig loadFile(String path) {
    byte[] data;
    try {
      data = fs.read(path);
    } catch (ProjectKitException e) {
      throw new ConfigException(
          ProjectKitErrorCode.CONFIG_LOAD_FAILED,
          "Failed to read " + path + ": " + e.getMessage(),
          Map.of("path", path),
          e);
    }

    // An empty file is a valid, empty configuration.
    if (new String(data, StandardCharsets.UTF_8).isBlank()) return ProjectConfig.empty();

    ProjectConfig config;
    try {
      config = JacksonUtility.getYamlMapper().readValue(data, ProjectConfig.class);
    } catch (Exception e) {
      throw new ConfigException(
          ProjectKitErrorCode.CONFIG_LOAD_FAILED,
          "Failed to parse " + path + ": " + e.getMessage(),
          Map.of("path", path),
          e);
    }
    return config == null ? ProjectConfig.empty() : config;
  }

  private static void validate(ProjectConfig config, String path) {
    Violations v = new Violations();
    if (config.rulebook() != null && v.notEmpty("rulebook.sources", config.rulebook().sources())) {
      v.sources("rulebook", config.rulebook());
    }
    if (config.ai() != null) {
      v.sources("ai.instruction", config.ai().instruction());
      v.sources("ai.skill", config.ai().skill());
      v.sources("ai.workflow", config.ai().workflow());
      v.sources("ai.mcp", config.ai().mcp());
    }
    if (config.doc() != null) {
      v.sources("doc.standard", config.doc().standard());
    }
    if (!v.isEmpty()) {
      throw new ConfigException(
          ProjectKitErrorCode.CONFIG_VALIDATION_FAILED,
          "Invalid " + path + ": " + String.join("; ", v.toList()),
          Map.of("path", path),
          null);
    }
  }
}
