package com.gentoro.projectkit.ai.instruction;

import java.util.List;

/** Persistent store of instruction sets, sorted by category. */
public interface InstructionRepository {
  List<Instructions> getAll();

  void addInstructions(Instructions instructions);

  void removeAll();
}
