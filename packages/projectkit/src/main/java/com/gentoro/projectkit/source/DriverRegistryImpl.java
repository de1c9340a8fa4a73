package com.gentoro.projectkit.source;

import com.gentoro.projectkit.exception.ProjectKitErrorCode;
import com.gentoro.projectkit.exception.ProjectKitException;
import com.gentoro.projectkit.logging.LoggingService;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;

/**
 * Thread-safe {@link DriverRegistry}. Registration takes the write lock for the whole check and
 * insert, so a multi-scheme driver is never observed partially registered; lookups share the read
 * lock.
 */
public class DriverRegistryImpl implements DriverRegistry {
  private static final Logger log = LoggingService.getLogger(DriverRegistryImpl.class);

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, Driver> drivers = new HashMap<>();

  @Override
  public void registerDriver(Driver driver) {
    Objects.requireNonNull(driver, "driver");
    Set<String> schemes = driver.supportedSchemes();

    lock.writeLock().lock();
    try {
      for (String scheme : schemes) {
        if (drivers.containsKey(scheme)) {
          throw new ProjectKitException(
              ProjectKitErrorCode.SCHEME_DRIVER_ALREADY_REGISTERED,
              "Scheme already registered: " + scheme,
              Map.of("scheme", scheme));
        }
      }
      for (String scheme : schemes) {
        drivers.put(scheme, driver);
      }
    } finally {
      lock.writeLock().unlock();
    }
    log.debug("Registered driver {} for schemes {}", driver.getClass().getSimpleName(), schemes);
  }

  @Override
  public Driver getDriverByScheme(String scheme) {
    lock.readLock().lock();
    try {
      Driver driver = drivers.get(scheme);
      if (driver == null) {
        throw new ProjectKitException(
            ProjectKitErrorCode.SCHEME_DRIVER_NOT_REGISTERED,
            "Scheme not registered: " + scheme,
            Map.of("scheme", String.valueOf(scheme)));
      }
      return driver;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Set<String> supportedSchemes() {
    lock.readLock().lock();
    try {
      return new TreeSet<>(drivers.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }
}
