package com.gentoro.projectkit.loader;

import com.gentoro.projectkit.exception.ProjectKitErrorCode;
import java.util.Optional;

/** Kinds of resources handled by ProjectKit, with the code raised when a source holds none. */
public enum ResourceKind {
  INSTRUCTIONS("instructions", ProjectKitErrorCode.NO_INSTRUCTIONS_FOUND),
  SKILL("skills", ProjectKitErrorCode.NO_SKILLS_FOUND),
  MCP_SERVER("mcp servers", ProjectKitErrorCode.NO_MCP_SERVERS_FOUND),
  WORKFLOW("workflows", ProjectKitErrorCode.NO_WORKFLOWS_FOUND),
  STANDARD("standards", ProjectKitErrorCode.NO_STANDARDS_FOUND),
  // A rulebook source is one rulebook; a missing rulebook.yaml is RULEBOOK_METADATA_MISSING.
  RULEBOOK("rulebooks", null);

  private final String label;
  private final ProjectKitErrorCode noneFoundCode;

  ResourceKind(String label, ProjectKitErrorCode noneFoundCode) {
    this.label = label;
    this.noneFoundCode = noneFoundCode;
  }

  /** Plural, human readable name used in messages and logs. */
  public String label() {
    return label;
  }

  /**
   * @return the code raised when a source lists no resource of this kind; empty for kinds whose
   *     source is a single resource
   */
  public Optional<ProjectKitErrorCode> noneFoundCode() {
    return Optional.ofNullable(noneFoundCode);
  }
}
