package com.gentoro.projectkit.doc.standard;

import com.gentoro.projectkit.fs.SourceFs;
import com.gentoro.projectkit.repository.JsonFsRepository;
import java.util.List;

public class FsStandardRepository implements StandardRepository {
  private final JsonFsRepository<Standard> store;

  public FsStandardRepository(SourceFs fs) {
    this.store =
        new JsonFsRepository<>(
            fs,
            Standard.class,
            FsStandardRepository::idOf,
            JsonFsRepository.byKey(FsStandardRepository::nameOf));
  }

  private static String idOf(Standard standard) {
    return standard.metadata() == null ? null : standard.metadata().id();
  }

  private static String nameOf(Standard standard) {
    return standard.metadata() == null ? null : standard.metadata().name();
  }

  @Override
  public List<Standard> getAll() {
    return store.getAll();
  }

  @Override
  public void addStandard(Standard standard) {
    store.add(standard);
  }

  @Override
  public void removeAll() {
    store.removeAll();
  }
}
