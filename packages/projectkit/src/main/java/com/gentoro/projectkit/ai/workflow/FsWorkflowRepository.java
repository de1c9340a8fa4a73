package com.gentoro.projectkit.ai.workflow;

import com.gentoro.projectkit.exception.ProjectKitErrorCode;
import com.gentoro.projectkit.exception.ProjectKitException;
import com.gentoro.projectkit.fs.SourceFs;
import com.gentoro.projectkit.repository.JsonFsRepository;
import java.util.List;
import java.util.Map;

/**
 * Stores each workflow as {@code <id>.json} in one directory and each execution as {@code
 * <id>.json} in another.
 */
public class FsWorkflowRepository implements WorkflowRepository {
  private final JsonFsRepository<Workflow> workflows;
  private final JsonFsRepository<Execution> executions;

  public FsWorkflowRepository(SourceFs workflowFs, SourceFs executionFs) {
    this.workflows =
        new JsonFsRepository<>(
            workflowFs,
            Workflow.class,
            FsWorkflowRepository::idOf,
            JsonFsRepository.byKey(FsWorkflowRepository::idOf),
            ProjectKitErrorCode.WORKFLOW_ALREADY_EXISTS,
            FsWorkflowRepository::idOf);
    this.executions =
        new JsonFsRepository<>(
            executionFs,
            Execution.class,
            Execution::id,
            JsonFsRepository.byKey(Execution::id),
            ProjectKitErrorCode.EXECUTION_ALREADY_EXISTS,
            Execution::id);
  }

  private static String idOf(Workflow workflow) {
    return workflow.metadata() == null ? null : workflow.metadata().id();
  }

  private static void checkId(String kind, String id) {
    if (id == null || !WorkflowValidator.ID_PATTERN.matcher(id).matches()) {
      throw new ProjectKitException(
          ProjectKitErrorCode.INVALID_ARGUMENT,
          kind + " id must be alphanumeric with dashes: " + id,
          Map.of("id", String.valueOf(id)));
    }
  }

  @Override
  public void addWorkflow(Workflow workflow) {
    checkId("Workflow", idOf(workflow));
    workflows.add(workflow);
  }

  @Override
  public List<Workflow> getAllWorkflows() {
    return workflows.getAll();
  }

  @Override
  public Workflow getWorkflowById(String id) {
    checkId("Workflow", id);
    return workflows
        .findByIdentity(id)
        .orElseThrow(
            () ->
                new ProjectKitException(
                    ProjectKitErrorCode.WORKFLOW_NOT_FOUND,
                    "Workflow not found: " + id,
                    Map.of("id", id)));
  }

  @Override
  public void removeAllWorkflows() {
    workflows.removeAll();
  }

  @Override
  public void addExecution(Execution execution) {
    checkId("Execution", execution.id());
    executions.add(execution);
  }

  @Override
  public void updateExecution(Execution execution) {
    checkId("Execution", execution.id());
    executions.replace(execution, ProjectKitErrorCode.EXECUTION_NOT_FOUND);
  }

  @Override
  public Execution getExecutionById(String id) {
    checkId("Execution", id);
    return executions
        .findByIdentity(id)
        .orElseThrow(
            () ->
                new ProjectKitException(
                    ProjectKitErrorCode.EXECUTION_NOT_FOUND,
                    "Execution not found: " + id,
                    Map.of("id", id)));
  }
}
