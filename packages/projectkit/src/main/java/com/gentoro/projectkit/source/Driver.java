package com.gentoro.projectkit.source;

import com.gentoro.projectkit.fs.SourceFs;
import java.util.Set;

/**
 * Turns source URIs of one or more schemes into filesystem views.
 *
 * <p>Implementations hold no mutable state beyond their own root filesystem. The returned
 * filesystem is scoped to the addressed subtree and read-only, so loaders can never modify the
 * origin of the resources they read.
 */
public interface Driver {

  /** @return the fixed set of URI schemes handled by this driver (e.g. {@code local}). */
  Set<String> supportedSchemes();

  /**
   * Resolve a full source URI, scheme included.
   *
   * @param uri the complete URI as configured by the user
   * @return a read-only filesystem scoped to the addressed location
   * @throws com.gentoro.projectkit.exception.ProjectKitException when the URI cannot be resolved
   */
  SourceFs resolve(String uri);
}
