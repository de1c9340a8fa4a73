package com.gentoro.projectkit.repository;

import com.gentoro.projectkit.exception.ProjectKitErrorCode;
import com.gentoro.projectkit.exception.ProjectKitException;
import com.gentoro.projectkit.exception.SerializationException;
import com.gentoro.projectkit.fs.SourceFs;
import com.gentoro.projectkit.fs.SourcePaths;
import com.gentoro.projectkit.logging.LoggingService;
import com.gentoro.projectkit.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import org.slf4j.Logger;

/**
 * Stores resources as individual JSON files in a single directory.
 *
 * <p>Every resource is written to its own {@code <name>.json} file, the name being a random UUID
 * unless a naming function is given. Only {@code .json} files (any case) are considered when
 * reading; anything else in the directory is ignored.
 *
 * <p>Reads share a read lock, {@link #add}, {@link #replace} and {@link #removeAll} hold the write
 * lock for their whole duration, so an existence check and the following write are atomic.
 *
 * @param <T> record type stored by this repository
 */
public class JsonFsRepository<T> {
  private static final Logger log = LoggingService.getLogger(JsonFsRepository.class);
  private static final String EXTENSION = ".json";

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final SourceFs fs;
  private final Class<T> type;
  private final Function<T, String> identity;
  private final Comparator<T> order;
  private final ProjectKitErrorCode duplicateCode;
  private final Function<T, String> fileNaming;

  /** Repository without uniqueness constraint, storing resources under random file names. */
  public JsonFsRepository(
      SourceFs fs, Class<T> type, Function<T, String> identity, Comparator<T> order) {
    this(fs, type, identity, order, null, null);
  }

  /**
   * @param identity extracts the identity used by {@link #findByIdentity} and the uniqueness check
   * @param order ordering of {@link #getAll()}
   * @param duplicateCode when not null, {@link #add} rejects a resource whose identity is already
   *     stored with this code
   * @param fileNaming base file name for a resource; random UUIDs when null
   */
  public JsonFsRepository(
      SourceFs fs,
      Class<T> type,
      Function<T, String> identity,
      Comparator<T> order,
      ProjectKitErrorCode duplicateCode,
      Function<T, String> fileNaming) {
    this.fs = Objects.requireNonNull(fs, "fs");
    this.type = Objects.requireNonNull(type, "type");
    this.identity = Objects.requireNonNull(identity, "identity");
    this.order = Objects.requireNonNull(order, "order");
    this.duplicateCode = duplicateCode;
    this.fileNaming = fileNaming;
  }

  /** @return every stored resource in ascending order; never null. */
  public List<T> getAll() {
    lock.readLock().lock();
    try {
      return readAll();
    } finally {
      lock.readLock().unlock();
    }
  }

  /** @return the first stored resource with the given identity. */
  public Optional<T> findByIdentity(String id) {
    lock.readLock().lock();
    try {
      return readAll().stream().filter(r -> Objects.equals(identity.apply(r), id)).findFirst();
    } finally {
      lock.readLock().unlock();
    }
  }

  /** @return the stored resource with the given identity, or a RESOURCE_NOT_FOUND failure. */
  public T getByIdentity(String id) {
    return findByIdentity(id)
        .orElseThrow(
            () ->
                new ProjectKitException(
                    ProjectKitErrorCode.RESOURCE_NOT_FOUND,
                    "Resource not found: " + id,
                    Map.of("id", String.valueOf(id), "type", type.getSimpleName())));
  }

  public void add(T resource) {
    Objects.requireNonNull(resource, "resource");
    lock.writeLock().lock();
    try {
      if (duplicateCode != null) {
        String id = identity.apply(resource);
        boolean exists =
            readAll().stream().anyMatch(existing -> Objects.equals(identity.apply(existing), id));
        if (exists) {
          throw new ProjectKitException(
              duplicateCode,
              type.getSimpleName() + " already exists: " + id,
              Map.of("id", String.valueOf(id)));
        }
      }

      String baseName =
          fileNaming == null ? UUID.randomUUID().toString() : fileNaming.apply(resource);
      String fileName = baseName + EXTENSION;
      fs.write(fileName, JacksonUtility.toJsonBytes(resource));
      log.debug("Stored {} '{}' as {}", type.getSimpleName(), identity.apply(resource), fileName);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Overwrite the stored resource carrying the same identity. Only available when resources are
   * stored under a naming function, so the file to overwrite is known.
   *
   * @param notFoundCode code of the failure raised when no resource has that identity
   */
  public void replace(T resource, ProjectKitErrorCode notFoundCode) {
    Objects.requireNonNull(resource, "resource");
    if (fileNaming == null) {
      throw new IllegalStateException("replace requires a file naming function");
    }
    lock.writeLock().lock();
    try {
      String id = identity.apply(resource);
      boolean exists =
          readAll().stream().anyMatch(existing -> Objects.equals(identity.apply(existing), id));
      if (!exists) {
        throw new ProjectKitException(
            notFoundCode,
            type.getSimpleName() + " not found: " + id,
            Map.of("id", String.valueOf(id)));
      }
      String fileName = fileNaming.apply(resource) + EXTENSION;
      fs.write(fileName, JacksonUtility.toJsonBytes(resource));
      log.debug("Replaced {} '{}' in {}", type.getSimpleName(), id, fileName);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Delete every stored resource. Removing from an empty repository is a no-op. */
  public void removeAll() {
    lock.writeLock().lock();
    try {
      List<String> files = listFiles();
      for (String file : files) {
        fs.remove(file);
      }
      log.debug("Removed {} {} file(s)", files.size(), type.getSimpleName());
    } finally {
      lock.writeLock().unlock();
    }
  }

  private List<String> listFiles() {
    List<String> files = new ArrayList<>();
    for (SourceFs.Entry entry : fs.list(SourcePaths.ROOT)) {
      if (entry.directory()) continue;
      if (SourcePaths.extension(entry.name()).toLowerCase(Locale.ROOT).equals(EXTENSION)) {
        files.add(entry.name());
      }
    }
    return files;
  }

  private List<T> readAll() {
    List<T> resources = new ArrayList<>();
    for (String file : listFiles()) {
      resources.add(readFile(file));
    }
    resources.sort(order);
    return resources;
  }

  private T readFile(String file) {
    byte[] data = fs.read(file);
    try {
      return JacksonUtility.getJsonMapper().readValue(data, type);
    } catch (Exception e) {
      throw new SerializationException(
          "Failed to deserialize " + type.getSimpleName() + " from " + file,
          Map.of("path", file),
          e);
    }
  }

  /** Comparator on a string key, null keys first. */
  public static <T> Comparator<T> byKey(Function<T, String> key) {
    return Comparator.comparing(key, Comparator.nullsFirst(Comparator.naturalOrder()));
  }
}
