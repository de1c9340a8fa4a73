package com.gentoro.projectkit.fs;

import com.gentoro.projectkit.exception.IoException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * {@link SourceFs} backed by the local disk through {@code java.nio.file}.
 *
 * <p>Relative paths are resolved against the root directory given at construction time; absolute
 * paths are honored as they are. Use {@link #scoped(String)} to confine callers to a subtree.
 */
public class LocalSourceFs implements SourceFs {
  private final Path root;

  public LocalSourceFs(Path root) {
    this.root = root;
  }

  /** Filesystem rooted at the current working directory. */
  public static LocalSourceFs workingDirectory() {
    return new LocalSourceFs(Path.of("").toAbsolutePath());
  }

  public Path root() {
    return root;
  }

  Path toPath(String path) {
    String cleaned = SourcePaths.clean(path);
    if (cleaned.equals(SourcePaths.ROOT)) return root;
    return root.resolve(cleaned);
  }

  @Override
  public List<Entry> list(String dir) {
    Path target = toPath(dir);
    List<Entry> entries = new ArrayList<>();
    try (Stream<Path> children = Files.list(target)) {
      children.forEach(
          child ->
              entries.add(
                  new Entry(child.getFileName().toString(), Files.isDirectory(child))));
    } catch (IOException e) {
      throw failure("list directory", dir, e);
    }
    return entries;
  }

  @Override
  public byte[] read(String path) {
    try {
      return Files.readAllBytes(toPath(path));
    } catch (IOException e) {
      throw failure("read file", path, e);
    }
  }

  @Override
  public void write(String path, byte[] data) {
    try {
      Files.write(
          toPath(path),
          data,
          StandardOpenOption.CREATE,
          StandardOpenOption.TRUNCATE_EXISTING,
          StandardOpenOption.WRITE);
    } catch (IOException e) {
      throw failure("write file", path, e);
    }
  }

  @Override
  public void remove(String path) {
    try {
      Files.delete(toPath(path));
    } catch (IOException e) {
      throw failure("remove", path, e);
    }
  }

  @Override
  public boolean exists(String path) {
    return Files.exists(toPath(path));
  }

  @Override
  public boolean isDirectory(String path) {
    try {
      return Files.readAttributes(toPath(path), BasicFileAttributes.class).isDirectory();
    } catch (NoSuchFileException e) {
      return false;
    } catch (IOException e) {
      throw failure("check directory", path, e);
    }
  }

  @Override
  public void createDirectories(String path) {
    try {
      Files.createDirectories(toPath(path));
    } catch (IOException e) {
      throw failure("create directories", path, e);
    }
  }

  private IoException failure(String operation, String path, IOException cause) {
    return new IoException(
        "Failed to " + operation + ": " + toPath(path), Map.of("path", path), cause);
  }

  @Override
  public String toString() {
    return "LocalSourceFs{" + root + "}";
  }
}
