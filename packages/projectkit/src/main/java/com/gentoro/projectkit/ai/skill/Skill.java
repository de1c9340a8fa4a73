package com.gentoro.projectkit.ai.skill;

import com.gentoro.projectkit.utility.CollectionUtility;
import java.util.Map;

/**
 * A skill: metadata, free text instructions for the agent and optional helper scripts keyed by file
 * name.
 */
public record Skill(SkillMetadata metadata, String instructions, Map<String, Script> scripts) {

  public Skill {
    scripts = CollectionUtility.immutableMap(scripts);
  }
}
