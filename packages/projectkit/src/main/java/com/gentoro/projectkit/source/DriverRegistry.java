package com.gentoro.projectkit.source;

import java.util.Set;

/** Holds the scheme to {@link Driver} mapping used by the {@link SourceResolver}. */
public interface DriverRegistry {

  /**
   * Register every scheme of {@code driver}. Either all schemes are registered or none is.
   *
   * @throws com.gentoro.projectkit.exception.ProjectKitException with code {@code
   *     SCHEME_DRIVER_ALREADY_REGISTERED} when one of the schemes is taken
   */
  void registerDriver(Driver driver);

  /**
   * @throws com.gentoro.projectkit.exception.ProjectKitException with code {@code
   *     SCHEME_DRIVER_NOT_REGISTERED} when no driver owns {@code scheme}
   */
  Driver getDriverByScheme(String scheme);

  /** @return snapshot of the registered schemes. */
  Set<String> supportedSchemes();
}
