package com.gentoro.projectkit.doc.standard;

import java.util.List;

/** Persistent store of documentation standards, sorted by name. */
public interface StandardRepository {
  List<Standard> getAll();

  void addStandard(Standard standard);

  void removeAll();
}
