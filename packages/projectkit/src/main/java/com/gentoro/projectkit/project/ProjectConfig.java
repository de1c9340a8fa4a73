package com.gentoro.projectkit.project;

import com.gentoro.projectkit.ai.AiConfig;
import com.gentoro.projectkit.doc.DocConfig;
import com.gentoro.projectkit.source.SourcesConfig;

/**
 * Project configuration as found in {@code .projectkit.yaml}:
 *
 * <pre>
 * rulebook:
 *   sources:
 *     - uri: local://rulebooks/general
 * ai:
 *   instruction:
 *     sources:
 *       - uri: local://ai/instructions
 * doc:
 *   standard:
 *     sources: []
 * </pre>
 */
public record ProjectConfig(SourcesConfig rulebook, AiConfig ai, DocConfig doc) {

  /** A configuration with every section present and no sources. */
  public static ProjectConfig empty() {
    return new ProjectConfig(
        SourcesConfig.empty(),
        new AiConfig(
            SourcesConfig.empty(),
            SourcesConfig.empty(),
            SourcesConfig.empty(),
            SourcesConfig.empty()),
        new DocConfig(SourcesConfig.empty()));
  }

  /** @return a configuration listing the sources of {@code this} followed by {@code other}'s. */
  public ProjectConfig merge(ProjectConfig other) {
    if (other == null) return this;
    SourcesConfig mergedRulebook =
        rulebook == null
            ? other.rulebook()
            : other.rulebook() == null ? rulebook : rulebook.concat(other.rulebook());
    AiConfig mergedAi = ai == null ? other.ai() : ai.merge(other.ai());
    DocConfig mergedDoc = doc == null ? other.doc() : doc.merge(other.doc());
    return new ProjectConfig(mergedRulebook, mergedAi, mergedDoc);
  }
}
