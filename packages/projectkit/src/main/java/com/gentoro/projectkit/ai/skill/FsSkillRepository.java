package com.gentoro.projectkit.ai.skill;

import com.gentoro.projectkit.exception.ProjectKitErrorCode;
import com.gentoro.projectkit.exception.ProjectKitException;
import com.gentoro.projectkit.fs.SourceFs;
import com.gentoro.projectkit.repository.JsonFsRepository;
import java.util.List;
import java.util.Map;

public class FsSkillRepository implements SkillRepository {
  private final JsonFsRepository<Skill> store;

  public FsSkillRepository(SourceFs fs) {
    this.store =
        new JsonFsRepository<>(
            fs,
            Skill.class,
            FsSkillRepository::nameOf,
            JsonFsRepository.byKey(FsSkillRepository::nameOf),
            ProjectKitErrorCode.SKILL_ALREADY_EXISTS,
            null);
  }

  private static String nameOf(Skill skill) {
    return skill.metadata() == null ? null : skill.metadata().name();
  }

  @Override
  public Skill getSkillByName(String name) {
    return store
        .findByIdentity(name)
        .orElseThrow(
            () ->
                new ProjectKitException(
                    ProjectKitErrorCode.SKILL_NOT_FOUND,
                    "Skill not found: " + name,
                    Map.of("name", String.valueOf(name))));
  }

  @Override
  public List<Skill> getAll() {
    return store.getAll();
  }

  @Override
  public void addSkill(Skill skill) {
    store.add(skill);
  }

  @Override
  public void removeAll() {
    store.removeAll();
  }
}
