package com.gentoro.projectkit.loader;

import com.gentoro.projectkit.exception.ProjectKitErrorCode;
import com.gentoro.projectkit.exception.ProjectKitException;
import com.gentoro.projectkit.exception.ValidationException;
import com.gentoro.projectkit.fs.SourceFs;
import com.gentoro.projectkit.fs.SourcePaths;
import com.gentoro.projectkit.logging.LoggingService;
import com.gentoro.projectkit.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * Loads resources stored one per YAML file at the top level of a source.
 *
 * <p>Only regular files ending in {@code .yaml} or {@code .yml} (any case) are considered;
 * directories and other files are skipped. Files are processed in listing order and every file
 * goes through read, parse and validate. The first failure aborts the whole load.
 *
 * @param <T> record type of the resource kind
 */
public class FlatFileLoader<T> implements ResourceLoader<T> {
  private static final Logger log = LoggingService.getLogger(FlatFileLoader.class);

  private final ResourceKind kind;
  private final ProjectKitErrorCode noneFoundCode;
  private final Class<T> type;
  private final ResourceValidator<T> validator;

  public FlatFileLoader(ResourceKind kind, Class<T> type, ResourceValidator<T> validator) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.noneFoundCode =
        kind.noneFoundCode()
            .orElseThrow(
                () -> new IllegalArgumentException(kind + " resources are not stored as files"));
    this.type = Objects.requireNonNull(type, "type");
    this.validator = Objects.requireNonNull(validator, "validator");
  }

  public ResourceKind kind() {
    return kind;
  }

  @Override
  public List<T> load(SourceFs fs) {
    List<String> files = resolveFiles(fs);
    if (files.isEmpty()) {
      throw new ProjectKitException(
          noneFoundCode, "No " + kind.label() + " found", Map.of("kind", kind.label()));
    }

    List<T> resources = new ArrayList<>(files.size());
    for (String file : files) {
      resources.add(loadFile(fs, file));
    }
    log.debug("Loaded {} {}", resources.size(), kind.label());
    return List.copyOf(resources);
  }

  List<String> resolveFiles(SourceFs fs) {
    List<SourceFs.Entry> entries;
    try {
      entries = fs.list(SourcePaths.ROOT);
    } catch (ProjectKitException e) {
      throw new ProjectKitException(
          ProjectKitErrorCode.READ_FAILED,
          "Failed to read " + kind.label() + " directory: " + e.getMessage(),
          Map.of("kind", kind.label()),
          e);
    }

    List<String> files = new ArrayList<>();
    for (SourceFs.Entry entry : entries) {
      if (entry.directory() || !StructuredFiles.isYaml(entry.name())) continue;
      files.add(entry.name());
    }
    return files;
  }

  T loadFile(SourceFs fs, String path) {
    byte[] data = readResource(fs, path, kind);
    T resource = parseYaml(data, type, path, kind);
    validate(resource, validator, path, kind);
    return resource;
  }

  static byte[] readResource(SourceFs fs, String path, ResourceKind kind) {
    try {
      return fs.read(path);
    } catch (ProjectKitException e) {
      throw new ProjectKitException(
          ProjectKitErrorCode.READ_FAILED,
          "Failed to read file " + path + ": " + e.getMessage(),
          Map.of("path", path, "kind", kind.label()),
          e);
    }
  }

  /**
   * Deserialize a YAML document. An empty document is reported as a parse failure since it cannot
   * describe a resource.
   */
  public static <R> R parseYaml(byte[] data, Class<R> type, String path, ResourceKind kind) {
    R value;
    try {
      value = JacksonUtility.getYamlMapper().readValue(data, type);
    } catch (Exception e) {
      throw new ProjectKitException(
          ProjectKitErrorCode.PARSE_FAILED,
          "Failed to parse file " + path + ": " + e.getMessage(),
          Map.of("path", path, "kind", kind.label()),
          e);
    }
    if (value == null) {
      throw new ProjectKitException(
          ProjectKitErrorCode.PARSE_FAILED,
          "Failed to parse file " + path + ": empty document",
          Map.of("path", path, "kind", kind.label()));
    }
    return value;
  }

  public static <R> void validate(
      R resource, ResourceValidator<R> validator, String path, ResourceKind kind) {
    List<String> violations = validator.validate(resource);
    if (!violations.isEmpty()) {
      throw new ValidationException(
          "Invalid " + kind.label() + " in file " + path,
          violations,
          Map.of("path", path, "kind", kind.label()));
    }
  }
}
