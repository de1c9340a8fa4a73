package com.gentoro.projectkit.ai.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * A run of a workflow: the step it is at and the current value of each state variable declared by
 * the workflow.
 */
public record Execution(
    String id, String workflowId, Map<String, JsonNode> stateValues, String stepId) {

  public Execution {
    stateValues = Workflow.copyNodes(stateValues);
  }
}
