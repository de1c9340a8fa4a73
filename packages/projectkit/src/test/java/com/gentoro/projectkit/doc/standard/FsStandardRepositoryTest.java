package com.gentoro.projectkit.doc.standard;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.projectkit.fs.MemorySourceFs;
import java.util.List;
import org.junit.jupiter.api.Test;

class FsStandardRepositoryTest {

  private static Standard standard(String id, String name) {
    return new Standard(
        new Standard.Metadata(id, name, "1.0.0", List.of("tag"), null, null),
        new Standard.Specification("Purpose of " + name, List.of("A goal"), null),
        null,
        new Standard.Requirements(List.of()),
        null,
        new Standard.Examples(List.of(), List.of()),
        null);
  }

  @Test
  void standardsAreSortedByNameAndSurviveStorage() {
    FsStandardRepository repository = new FsStandardRepository(new MemorySourceFs());
    Standard beta = standard("beta", "Beta");
    Standard alpha = standard("alpha", "Alpha");

    repository.addStandard(beta);
    repository.addStandard(alpha);

    assertEquals(List.of(alpha, beta), repository.getAll());

    repository.removeAll();
    assertEquals(List.of(), repository.getAll());
  }
}
