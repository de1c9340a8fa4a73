package com.gentoro.projectkit.source;

import com.gentoro.projectkit.fs.SourceFs;

/** Resolves any source URI to a filesystem by dispatching on its scheme. */
public interface SourceResolver {

  /**
   * @param uri source URI of the form {@code scheme://opaque}
   * @return the read-only filesystem produced by the driver owning the scheme
   * @throws com.gentoro.projectkit.exception.ProjectKitException with code {@code
   *     URI_SCHEME_NOT_FOUND} when the URI has no {@code ://} separator, or the code of the
   *     registry or driver failure
   */
  SourceFs resolve(String uri);
}
