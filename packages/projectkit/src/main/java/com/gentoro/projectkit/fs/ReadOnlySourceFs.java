package com.gentoro.projectkit.fs;

import com.gentoro.projectkit.exception.ProjectKitErrorCode;
import com.gentoro.projectkit.exception.ProjectKitException;
import java.util.List;
import java.util.Map;

/** View of a {@link SourceFs} that rejects writes, removals and directory creation. */
public class ReadOnlySourceFs implements SourceFs {
  private final SourceFs delegate;

  public ReadOnlySourceFs(SourceFs delegate) {
    this.delegate = delegate;
  }

  @Override
  public List<Entry> list(String dir) {
    return delegate.list(dir);
  }

  @Override
  public byte[] read(String path) {
    return delegate.read(path);
  }

  @Override
  public void write(String path, byte[] data) {
    throw denied("write", path);
  }

  @Override
  public void remove(String path) {
    throw denied("remove", path);
  }

  @Override
  public boolean exists(String path) {
    return delegate.exists(path);
  }

  @Override
  public boolean isDirectory(String path) {
    return delegate.isDirectory(path);
  }

  @Override
  public void createDirectories(String path) {
    throw denied("create directories", path);
  }

  @Override
  public SourceFs readOnly() {
    return this;
  }

  private static ProjectKitException denied(String operation, String path) {
    return new ProjectKitException(
        ProjectKitErrorCode.PERMISSION_DENIED,
        "Filesystem is read-only, cannot " + operation + ": " + path,
        Map.of("path", path));
  }

  @Override
  public String toString() {
    return "ReadOnlySourceFs{" + delegate + "}";
  }
}
