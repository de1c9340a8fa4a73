package com.gentoro.projectkit.ai.skill;

/** Contents of a skill's {@code metadata.yaml}. */
public record SkillMetadata(String name, String description) {}
