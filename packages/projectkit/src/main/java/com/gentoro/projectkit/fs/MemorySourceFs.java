package com.gentoro.projectkit.fs;

import com.gentoro.projectkit.exception.IoException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * In-memory {@link SourceFs}. Listings come back in lexical order. Writing a file registers its
 * parent directories implicitly. All operations are synchronized on the instance.
 */
public class MemorySourceFs implements SourceFs {
  private final TreeMap<String, byte[]> files = new TreeMap<>();
  private final TreeSet<String> directories = new TreeSet<>();

  public MemorySourceFs() {
    directories.add(SourcePaths.ROOT);
  }

  private static String key(String path) {
    String cleaned = SourcePaths.clean(path);
    if (cleaned.startsWith("/")) {
      cleaned = SourcePaths.clean(cleaned.substring(1));
    }
    return cleaned;
  }

  private static String parentOf(String key) {
    int idx = key.lastIndexOf('/');
    return idx < 0 ? SourcePaths.ROOT : key.substring(0, idx);
  }

  private void registerParents(String key) {
    String parent = parentOf(key);
    while (!parent.equals(SourcePaths.ROOT) && directories.add(parent)) {
      parent = parentOf(parent);
    }
  }

  @Override
  public synchronized List<Entry> list(String dir) {
    String key = key(dir);
    if (files.containsKey(key)) {
      throw new IoException(
          "Failed to list directory: " + dir, Map.of("path", dir), new NotDirectoryException(key));
    }
    if (!directories.contains(key)) {
      throw new IoException(
          "Failed to list directory: " + dir, Map.of("path", dir), new NoSuchFileException(key));
    }

    TreeMap<String, Entry> children = new TreeMap<>();
    for (String d : directories) {
      if (!d.equals(key) && !d.equals(SourcePaths.ROOT) && parentOf(d).equals(key)) {
        String name = SourcePaths.fileName(d);
        children.put(name, new Entry(name, true));
      }
    }
    for (String f : files.keySet()) {
      if (parentOf(f).equals(key)) {
        String name = SourcePaths.fileName(f);
        children.put(name, new Entry(name, false));
      }
    }
    return new ArrayList<>(children.values());
  }

  @Override
  public synchronized byte[] read(String path) {
    byte[] data = files.get(key(path));
    if (data == null) {
      throw new IoException(
          "Failed to read file: " + path, Map.of("path", path), new NoSuchFileException(path));
    }
    return data.clone();
  }

  @Override
  public synchronized void write(String path, byte[] data) {
    String key = key(path);
    if (directories.contains(key)) {
      throw new IoException(
          "Failed to write file: " + path,
          Map.of("path", path),
          new FileAlreadyExistsException(path));
    }
    registerParents(key);
    files.put(key, data.clone());
  }

  @Override
  public synchronized void remove(String path) {
    String key = key(path);
    if (files.remove(key) != null) return;
    if (directories.contains(key) && !key.equals(SourcePaths.ROOT)) {
      boolean hasChildren =
          directories.stream().anyMatch(d -> !d.equals(key) && parentOf(d).equals(key))
              || files.keySet().stream().anyMatch(f -> parentOf(f).equals(key));
      if (hasChildren) {
        throw new IoException(
            "Failed to remove: " + path,
            Map.of("path", path),
            new DirectoryNotEmptyException(path));
      }
      directories.remove(key);
      return;
    }
    throw new IoException(
        "Failed to remove: " + path, Map.of("path", path), new NoSuchFileException(path));
  }

  @Override
  public synchronized boolean exists(String path) {
    String key = key(path);
    return files.containsKey(key) || directories.contains(key);
  }

  @Override
  public synchronized boolean isDirectory(String path) {
    return directories.contains(key(path));
  }

  @Override
  public synchronized void createDirectories(String path) {
    String key = key(path);
    if (files.containsKey(key)) {
      throw new IoException(
          "Failed to create directories: " + path,
          Map.of("path", path),
          new FileAlreadyExistsException(path));
    }
    registerParents(key);
    directories.add(key);
  }

  /** Convenience for tests and fixtures: write a UTF-8 text file. */
  public MemorySourceFs withFile(String path, String content) {
    write(path, content.getBytes(java.nio.charset.StandardCharsets.UTF_8));
    return this;
  }

  /** Convenience for tests and fixtures: create a directory. */
  public MemorySourceFs withDirectory(String path) {
    createDirectories(path);
    return this;
  }

  @Override
  public String toString() {
    return "MemorySourceFs{files=" + files.size() + "}";
  }
}
