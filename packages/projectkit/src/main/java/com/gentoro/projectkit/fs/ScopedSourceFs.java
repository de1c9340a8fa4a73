package com.gentoro.projectkit.fs;

import com.gentoro.projectkit.exception.ProjectKitErrorCode;
import com.gentoro.projectkit.exception.ProjectKitException;
import java.util.List;
import java.util.Map;

/**
 * View of a {@link SourceFs} restricted to a subtree. Every path is interpreted relative to the
 * base, a leading {@code /} included, and paths climbing out of the base are rejected.
 */
public class ScopedSourceFs implements SourceFs {
  private final SourceFs delegate;
  private final String base;

  public ScopedSourceFs(SourceFs delegate, String base) {
    this.delegate = delegate;
    this.base = SourcePaths.clean(base);
  }

  public String base() {
    return base;
  }

  private String resolve(String path) {
    String relative = SourcePaths.clean(path);
    if (relative.startsWith("/")) {
      relative = SourcePaths.clean(relative.substring(1));
    }
    if (SourcePaths.escapesRoot(relative)) {
      throw new ProjectKitException(
          ProjectKitErrorCode.PERMISSION_DENIED,
          "Path escapes scoped filesystem: " + path,
          Map.of("path", path, "base", base));
    }
    return SourcePaths.join(base, relative);
  }

  @Override
  public List<Entry> list(String dir) {
    return delegate.list(resolve(dir));
  }

  @Override
  public byte[] read(String path) {
    return delegate.read(resolve(path));
  }

  @Override
  public void write(String path, byte[] data) {
    delegate.write(resolve(path), data);
  }

  @Override
  public void remove(String path) {
    delegate.remove(resolve(path));
  }

  @Override
  public boolean exists(String path) {
    return delegate.exists(resolve(path));
  }

  @Override
  public boolean isDirectory(String path) {
    return delegate.isDirectory(resolve(path));
  }

  @Override
  public void createDirectories(String path) {
    delegate.createDirectories(resolve(path));
  }

  @Override
  public String toString() {
    return "ScopedSourceFs{" + base + " of " + delegate + "}";
  }
}
