package com.gentoro.projectkit.rulebook;

import com.gentoro.projectkit.ai.instruction.Instructions;
import com.gentoro.projectkit.ai.mcp.McpServer;
import com.gentoro.projectkit.ai.skill.Skill;
import com.gentoro.projectkit.ai.workflow.Workflow;
import com.gentoro.projectkit.doc.standard.Standard;
import com.gentoro.projectkit.utility.CollectionUtility;
import java.util.List;

/** Every resource bundled by a rulebook, per kind, in source order. */
public record Rulebook(Ai ai, Doc doc) {

  public record Ai(
      List<Instructions> instructions,
      List<Skill> skills,
      List<Workflow> workflows,
      List<McpServer> mcpServers) {
    public Ai {
      instructions = CollectionUtility.immutableList(instructions);
      skills = CollectionUtility.immutableList(skills);
      workflows = CollectionUtility.immutableList(workflows);
      mcpServers = CollectionUtility.immutableList(mcpServers);
    }
  }

  public record Doc(List<Standard> standards) {
    public Doc {
      standards = CollectionUtility.immutableList(standards);
    }
  }
}
