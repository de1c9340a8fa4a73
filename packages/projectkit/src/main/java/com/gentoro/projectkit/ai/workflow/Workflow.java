package com.gentoro.projectkit.ai.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.projectkit.utility.CollectionUtility;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A multi-step workflow. {@code state} declares the workflow variables, each described by a JSON
 * schema kept as an opaque tree.
 */
public record Workflow(
    WorkflowMetadata metadata, Map<String, JsonNode> state, List<WorkflowStep> steps) {

  public Workflow {
    state = copyNodes(state);
    steps = CollectionUtility.immutableList(steps);
  }

  /** Read-only map of deep copies; JSON trees are mutable. */
  static Map<String, JsonNode> copyNodes(Map<String, JsonNode> nodes) {
    if (nodes == null) return null;
    Map<String, JsonNode> copy = new LinkedHashMap<>();
    nodes.forEach((name, node) -> copy.put(name, node == null ? null : node.deepCopy()));
    return CollectionUtility.immutableMap(copy);
  }
}
