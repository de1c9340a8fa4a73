package com.gentoro.projectkit.ai.skill;

import java.util.List;

/** Persistent store of skills. Skill names are unique. */
public interface SkillRepository {

  /**
   * @throws com.gentoro.projectkit.exception.ProjectKitException with code {@code SKILL_NOT_FOUND}
   *     when no skill has this name
   */
  Skill getSkillByName(String name);

  /** @return all skills sorted by name. */
  List<Skill> getAll();

  /**
   * @throws com.gentoro.projectkit.exception.ProjectKitException with code {@code
   *     SKILL_ALREADY_EXISTS} when a skill with the same name is stored already
   */
  void addSkill(Skill skill);

  void removeAll();
}
