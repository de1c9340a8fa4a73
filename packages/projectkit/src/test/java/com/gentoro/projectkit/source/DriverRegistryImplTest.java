package com.gentoro.projectkit.source;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.projectkit.exception.ProjectKitErrorCode;
import com.gentoro.projectkit.exception.ProjectKitException;
import com.gentoro.projectkit.fs.MemorySourceFs;
import com.gentoro.projectkit.fs.SourceFs;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DriverRegistryImplTest {

  private static Driver driver(String... schemes) {
    return new Driver() {
      @Override
      public Set<String> supportedSchemes() {
        return Set.of(schemes);
      }

      @Override
      public SourceFs resolve(String uri) {
        return new MemorySourceFs();
      }
    };
  }

  @Test
  void registeredDriverIsReturnedForEveryScheme() {
    DriverRegistryImpl registry = new DriverRegistryImpl();
    Driver multi = driver("git", "git+ssh");

    registry.registerDriver(multi);

    assertSame(multi, registry.getDriverByScheme("git"));
    assertSame(multi, registry.getDriverByScheme("git+ssh"));
    assertEquals(Set.of("git", "git+ssh"), registry.supportedSchemes());
  }

  @Test
  void unknownSchemeIsReported() {
    DriverRegistryImpl registry = new DriverRegistryImpl();
    registry.registerDriver(driver("local"));

    ProjectKitException e =
        assertThrows(ProjectKitException.class, () -> registry.getDriverByScheme("LOCAL"));
    assertEquals(ProjectKitErrorCode.SCHEME_DRIVER_NOT_REGISTERED, e.getCode());
  }

  @Test
  @DisplayName("A conflicting registration leaves the registry untouched")
  void conflictingRegistrationIsAtomic() {
    DriverRegistryImpl registry = new DriverRegistryImpl();
    Driver first = driver("a");
    registry.registerDriver(first);

    ProjectKitException e =
        assertThrows(ProjectKitException.class, () -> registry.registerDriver(driver("b", "a")));

    assertEquals(ProjectKitErrorCode.SCHEME_DRIVER_ALREADY_REGISTERED, e.getCode());
    assertEquals("a", e.getContext().get("scheme"));
    assertSame(first, registry.getDriverByScheme("a"));
    ProjectKitException missing =
        assertThrows(ProjectKitException.class, () -> registry.getDriverByScheme("b"));
    assertEquals(ProjectKitErrorCode.SCHEME_DRIVER_NOT_REGISTERED, missing.getCode());
  }

  @Test
  void concurrentRegistrationOfSameSchemeHasSingleWinner() throws Exception {
    DriverRegistryImpl registry = new DriverRegistryImpl();
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < 16; i++) {
        results.add(
            executor.submit(
                () -> {
                  try {
                    registry.registerDriver(driver("shared"));
                    return true;
                  } catch (ProjectKitException e) {
                    return false;
                  }
                }));
      }
      int winners = 0;
      for (Future<Boolean> result : results) {
        if (result.get(10, TimeUnit.SECONDS)) winners++;
      }
      assertEquals(1, winners);
      assertNotNull(registry.getDriverByScheme("shared"));
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void emptyRegistryHasNoDriver() {
    DriverRegistryImpl registry = new DriverRegistryImpl();

    ProjectKitException e =
        assertThrows(ProjectKitException.class, () -> registry.getDriverByScheme("local"));
    assertEquals(ProjectKitErrorCode.SCHEME_DRIVER_NOT_REGISTERED, e.getCode());
    assertTrue(registry.supportedSchemes().isEmpty());
  }
}
