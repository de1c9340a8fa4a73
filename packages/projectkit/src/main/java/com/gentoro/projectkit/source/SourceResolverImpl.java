package com.gentoro.projectkit.source;

import com.gentoro.projectkit.exception.ExceptionUtil;
import com.gentoro.projectkit.exception.ProjectKitErrorCode;
import com.gentoro.projectkit.exception.ProjectKitException;
import com.gentoro.projectkit.fs.SourceFs;
import java.util.Map;
import java.util.Objects;

/**
 * Default {@link SourceResolver}. The scheme is the text before the first {@code ://}; the driver
 * always receives the complete, unmodified URI.
 */
public class SourceResolverImpl implements SourceResolver {
  static final String SCHEME_SEPARATOR = "://";

  private final DriverRegistry driverRegistry;

  public SourceResolverImpl(DriverRegistry driverRegistry) {
    this.driverRegistry = Objects.requireNonNull(driverRegistry, "driverRegistry");
  }

  /**
   * @return the scheme of {@code uri}
   * @throws ProjectKitException with code {@code URI_SCHEME_NOT_FOUND} when there is none
   */
  public static String schemeOf(String uri) {
    int idx = uri == null ? -1 : uri.indexOf(SCHEME_SEPARATOR);
    if (idx < 0) {
      throw new ProjectKitException(
          ProjectKitErrorCode.URI_SCHEME_NOT_FOUND,
          "URI scheme not found: '" + uri + "'",
          Map.of("uri", String.valueOf(uri)));
    }
    return uri.substring(0, idx);
  }

  @Override
  public SourceFs resolve(String uri) {
    String scheme = schemeOf(uri);

    Driver driver;
    try {
      driver = driverRegistry.getDriverByScheme(scheme);
    } catch (ProjectKitException e) {
      throw ExceptionUtil.wrap("get driver by scheme", e, Map.of("uri", uri, "scheme", scheme));
    }

    try {
      return driver.resolve(uri);
    } catch (ProjectKitException e) {
      throw ExceptionUtil.wrap("resolve " + uri, e, Map.of("uri", uri, "scheme", scheme));
    }
  }
}
