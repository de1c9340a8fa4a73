package com.gentoro.projectkit.ai;

import com.gentoro.projectkit.source.SourcesConfig;

/** Sources of the AI resource kinds. Every section is optional. */
public record AiConfig(
    SourcesConfig instruction, SourcesConfig skill, SourcesConfig workflow, SourcesConfig mcp) {

  public static AiConfig empty() {
    return new AiConfig(null, null, null, null);
  }

  /** @return a config whose source lists are those of {@code this} followed by {@code other}'s. */
  public AiConfig merge(AiConfig other) {
    if (other == null) return this;
    return new AiConfig(
        concat(instruction, other.instruction()),
        concat(skill, other.skill()),
        concat(workflow, other.workflow()),
        concat(mcp, other.mcp()));
  }

  static SourcesConfig concat(SourcesConfig first, SourcesConfig second) {
    if (first == null) return second;
    if (second == null) return first;
    return first.concat(second);
  }
}
