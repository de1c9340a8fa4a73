package com.gentoro.projectkit.fs;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Minimal filesystem capability consumed by drivers, loaders and repositories.
 *
 * <p>Paths are {@code /}-separated strings relative to the root of the filesystem; {@code "."}
 * denotes the root itself. Implementations raise {@link
 * com.gentoro.projectkit.exception.IoException} for backend failures, keeping the original {@link
 * java.io.IOException} as cause, so callers can inspect e.g. {@link
 * java.nio.file.NoSuchFileException} through the cause chain.
 *
 * <p>The concrete backing (local disk or memory) is irrelevant to the callers; the
 * {@link #scoped(String)} and {@link #readOnly()} views work on top of every implementation.
 */
public interface SourceFs {

  /** A directory entry as returned by {@link #list(String)}. */
  record Entry(String name, boolean directory) {}

  /**
   * List the direct children of a directory. The order is the one of the backing store and is not
   * guaranteed to be sorted.
   */
  List<Entry> list(String dir);

  /** Read a whole file. */
  byte[] read(String path);

  /** Create or truncate a file with the given content. The parent directory must exist. */
  void write(String path, byte[] data);

  /** Remove a file or an empty directory. */
  void remove(String path);

  /** @return true when a file or directory exists at {@code path}. */
  boolean exists(String path);

  /**
   * @return true when {@code path} exists and is a directory, false when it does not exist or is
   *     not a directory. Failures to check are raised, not reported as {@code false}.
   */
  boolean isDirectory(String path);

  /** Create a directory and all its missing parents. */
  void createDirectories(String path);

  /** Read a whole file as UTF-8 text. */
  default String readString(String path) {
    return new String(read(path), StandardCharsets.UTF_8);
  }

  /** @return a view of this filesystem restricted to {@code subtree}. */
  default SourceFs scoped(String subtree) {
    return new ScopedSourceFs(this, subtree);
  }

  /** @return a view of this filesystem that rejects every mutation. */
  default SourceFs readOnly() {
    return new ReadOnlySourceFs(this);
  }
}
