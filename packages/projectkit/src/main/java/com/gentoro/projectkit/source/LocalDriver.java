package com.gentoro.projectkit.source;

import com.gentoro.projectkit.exception.ProjectKitErrorCode;
import com.gentoro.projectkit.exception.ProjectKitException;
import com.gentoro.projectkit.fs.LocalSourceFs;
import com.gentoro.projectkit.fs.SourceFs;
import com.gentoro.projectkit.fs.SourcePaths;
import java.util.Map;
import java.util.Set;

/**
 * Driver for {@code local://<path>} URIs. The path may be absolute or relative to the root
 * filesystem (the working directory by default) and is cleaned before use.
 */
public class LocalDriver implements Driver {
  public static final String SCHEME = "local";

  private final String scheme;
  private final String prefix;
  private final SourceFs rootFs;

  public LocalDriver() {
    this(LocalSourceFs.workingDirectory());
  }

  public LocalDriver(SourceFs rootFs) {
    this(SCHEME, rootFs);
  }

  /** Serve {@code <scheme>://<path>} URIs as directories of {@code rootFs}. */
  protected LocalDriver(String scheme, SourceFs rootFs) {
    this.scheme = scheme;
    this.prefix = scheme + SourceResolverImpl.SCHEME_SEPARATOR;
    this.rootFs = rootFs;
  }

  @Override
  public Set<String> supportedSchemes() {
    return Set.of(scheme);
  }

  @Override
  public SourceFs resolve(String uri) {
    if (uri == null || !uri.startsWith(prefix)) {
      throw new ProjectKitException(
          ProjectKitErrorCode.UNSUPPORTED_SCHEME,
          "Unsupported scheme in uri: " + uri,
          Map.of("uri", String.valueOf(uri)));
    }

    String rawPath = uri.substring(prefix.length());
    if (rawPath.isEmpty()) {
      throw new ProjectKitException(
          ProjectKitErrorCode.SOURCE_PATH_EMPTY, "Empty path in uri: " + uri, Map.of("uri", uri));
    }

    String path = SourcePaths.clean(rawPath);

    boolean exists;
    try {
      exists = rootFs.isDirectory(path);
    } catch (ProjectKitException e) {
      throw new ProjectKitException(
          ProjectKitErrorCode.SOURCE_PATH_CHECK_FAILED,
          "Checking path " + path + ": " + e.getMessage(),
          Map.of("uri", uri, "path", path),
          e);
    }
    if (!exists) {
      throw new ProjectKitException(
          ProjectKitErrorCode.SOURCE_PATH_NOT_FOUND,
          "Path " + path + " does not exist",
          Map.of("uri", uri, "path", path));
    }

    return rootFs.scoped(path).readOnly();
  }
}
