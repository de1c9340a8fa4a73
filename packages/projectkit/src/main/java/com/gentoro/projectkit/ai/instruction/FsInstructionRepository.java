package com.gentoro.projectkit.ai.instruction;

import com.gentoro.projectkit.fs.SourceFs;
import com.gentoro.projectkit.repository.JsonFsRepository;
import java.util.List;

public class FsInstructionRepository implements InstructionRepository {
  private final JsonFsRepository<Instructions> store;

  public FsInstructionRepository(SourceFs fs) {
    this.store =
        new JsonFsRepository<>(
            fs,
            Instructions.class,
            Instructions::category,
            JsonFsRepository.byKey(Instructions::category));
  }

  @Override
  public List<Instructions> getAll() {
    return store.getAll();
  }

  @Override
  public void addInstructions(Instructions instructions) {
    store.add(instructions);
  }

  @Override
  public void removeAll() {
    store.removeAll();
  }
}
