package com.gentoro.projectkit.ai.workflow;

import java.util.List;

/**
 * Persistent store of workflows and of their executions, both keyed by id. Removing the workflows
 * leaves the executions in place.
 */
public interface WorkflowRepository {

  /**
   * @throws com.gentoro.projectkit.exception.ProjectKitException {@code WORKFLOW_ALREADY_EXISTS}
   *     for a duplicate id, {@code INVALID_ARGUMENT} for a malformed one
   */
  void addWorkflow(Workflow workflow);

  /** @return all workflows sorted by id. */
  List<Workflow> getAllWorkflows();

  /**
   * @throws com.gentoro.projectkit.exception.ProjectKitException {@code WORKFLOW_NOT_FOUND} when
   *     absent, {@code INVALID_ARGUMENT} for a malformed id
   */
  Workflow getWorkflowById(String id);

  void removeAllWorkflows();

  /**
   * @throws com.gentoro.projectkit.exception.ProjectKitException {@code EXECUTION_ALREADY_EXISTS}
   *     for a duplicate id, {@code INVALID_ARGUMENT} for a malformed one
   */
  void addExecution(Execution execution);

  /**
   * Overwrite a stored execution.
   *
   * @throws com.gentoro.projectkit.exception.ProjectKitException {@code EXECUTION_NOT_FOUND} when
   *     no execution has that id, {@code INVALID_ARGUMENT} for a malformed one
   */
  void updateExecution(Execution execution);

  /**
   * @throws com.gentoro.projectkit.exception.ProjectKitException {@code EXECUTION_NOT_FOUND} when
   *     absent, {@code INVALID_ARGUMENT} for a malformed id
   */
  Execution getExecutionById(String id);
}
