package com.gentoro.projectkit.ai.workflow;

import com.gentoro.projectkit.utility.CollectionUtility;
import java.util.List;

/** One step of a workflow with the instructions the agent follows while in it. */
public record WorkflowStep(String id, String name, String description, List<String> instructions) {

  public WorkflowStep {
    instructions = CollectionUtility.immutableList(instructions);
  }
}
