package com.gentoro.projectkit.ai.workflow;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.projectkit.exception.ProjectKitErrorCode;
import com.gentoro.projectkit.exception.ProjectKitException;
import com.gentoro.projectkit.fs.MemorySourceFs;
import com.gentoro.projectkit.utility.JacksonUtility;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FsWorkflowRepositoryTest {

  private MemorySourceFs fs;
  private FsWorkflowRepository repository;

  @BeforeEach
  void setUp() {
    fs = new MemorySourceFs().withDirectory("workflows").withDirectory("executions");
    repository = new FsWorkflowRepository(fs.scoped("workflows"), fs.scoped("executions"));
  }

  private static Execution execution(String id, String stepId, int counter) {
    return new Execution(
        id, "deploy", Map.of("counter", JsonNodeFactory.instance.numberNode(counter)), stepId);
  }

  private static Workflow workflow(String id, String name) {
    JsonNode schema = JacksonUtility.getJsonMapper().createObjectNode().put("type", "integer");
    return new Workflow(
        new WorkflowMetadata(id, name, "Workflow " + name, "1.0.0"),
        Map.of("counter", schema),
        List.of(new WorkflowStep("s1", "Step", "First step", List.of("Do it"))));
  }

  @Test
  void workflowIsStoredUnderItsId() {
    Workflow workflow = workflow("deploy", "Deploy");
    repository.addWorkflow(workflow);

    assertTrue(fs.exists("workflows/deploy.json"));
    assertEquals(workflow, repository.getWorkflowById("deploy"));
  }

  @Test
  void workflowsAreSortedById() {
    repository.addWorkflow(workflow("w2", "Alpha"));
    repository.addWorkflow(workflow("w1", "Zulu"));

    assertEquals(
        List.of("w1", "w2"),
        repository.getAllWorkflows().stream().map(w -> w.metadata().id()).toList());
  }

  @Test
  void duplicateIdIsRejected() {
    repository.addWorkflow(workflow("deploy", "Deploy"));

    ProjectKitException e =
        assertThrows(
            ProjectKitException.class, () -> repository.addWorkflow(workflow("deploy", "Other")));
    assertEquals(ProjectKitErrorCode.WORKFLOW_ALREADY_EXISTS, e.getCode());
    assertEquals("Deploy", repository.getWorkflowById("deploy").metadata().name());
  }

  @Test
  void unknownIdIsNotFound() {
    ProjectKitException e =
        assertThrows(ProjectKitException.class, () -> repository.getWorkflowById("missing"));
    assertEquals(ProjectKitErrorCode.WORKFLOW_NOT_FOUND, e.getCode());
  }

  @Test
  void idThatCouldEscapeTheDirectoryIsRejected() {
    ProjectKitException lookup =
        assertThrows(ProjectKitException.class, () -> repository.getWorkflowById("../secret"));
    assertEquals(ProjectKitErrorCode.INVALID_ARGUMENT, lookup.getCode());

    ProjectKitException add =
        assertThrows(
            ProjectKitException.class, () -> repository.addWorkflow(workflow("a/b", "Nested")));
    assertEquals(ProjectKitErrorCode.INVALID_ARGUMENT, add.getCode());
    assertTrue(fs.list("workflows").isEmpty());
  }

  @Test
  void removeAllWorkflows() {
    repository.addWorkflow(workflow("a", "A"));
    repository.addWorkflow(workflow("b", "B"));

    repository.removeAllWorkflows();

    assertTrue(repository.getAllWorkflows().isEmpty());
  }

  @Test
  void removingWorkflowsKeepsExecutions() {
    repository.addWorkflow(workflow("deploy", "Deploy"));
    repository.addExecution(execution("run-1", "s1", 0));

    repository.removeAllWorkflows();

    assertEquals(execution("run-1", "s1", 0), repository.getExecutionById("run-1"));
  }

  @Test
  void executionIsStoredUnderItsId() {
    Execution execution = execution("run-1", "s1", 0);
    repository.addExecution(execution);

    assertTrue(fs.exists("executions/run-1.json"));
    assertEquals(execution, repository.getExecutionById("run-1"));
    assertEquals(0, repository.getExecutionById("run-1").stateValues().get("counter").asInt());
  }

  @Test
  void duplicateExecutionIdIsRejected() {
    repository.addExecution(execution("run-1", "s1", 0));

    ProjectKitException e =
        assertThrows(
            ProjectKitException.class,
            () -> repository.addExecution(execution("run-1", "s2", 5)));
    assertEquals(ProjectKitErrorCode.EXECUTION_ALREADY_EXISTS, e.getCode());
    assertEquals("s1", repository.getExecutionById("run-1").stepId());
  }

  @Test
  void updateOverwritesStoredExecution() {
    repository.addExecution(execution("run-1", "s1", 0));

    repository.updateExecution(execution("run-1", "s2", 3));

    Execution stored = repository.getExecutionById("run-1");
    assertEquals("s2", stored.stepId());
    assertEquals(3, stored.stateValues().get("counter").asInt());
    assertEquals(1, fs.list("executions").size());
  }

  @Test
  void updatingUnknownExecutionIsNotFound() {
    ProjectKitException e =
        assertThrows(
            ProjectKitException.class,
            () -> repository.updateExecution(execution("run-1", "s1", 0)));
    assertEquals(ProjectKitErrorCode.EXECUTION_NOT_FOUND, e.getCode());
    assertFalse(fs.exists("executions/run-1.json"));
  }

  @Test
  void unknownExecutionIsNotFound() {
    ProjectKitException e =
        assertThrows(ProjectKitException.class, () -> repository.getExecutionById("missing"));
    assertEquals(ProjectKitErrorCode.EXECUTION_NOT_FOUND, e.getCode());
  }

  @Test
  void malformedExecutionIdIsRejected() {
    for (String id : List.of("", "run_1", "../run", "run 1")) {
      ProjectKitException lookup =
          assertThrows(ProjectKitException.class, () -> repository.getExecutionById(id));
      assertEquals(ProjectKitErrorCode.INVALID_ARGUMENT, lookup.getCode(), id);

      ProjectKitException add =
          assertThrows(
              ProjectKitException.class, () -> repository.addExecution(execution(id, "s1", 0)));
      assertEquals(ProjectKitErrorCode.INVALID_ARGUMENT, add.getCode(), id);
    }
    assertTrue(fs.list("executions").isEmpty());
  }

  @Test
  void executionStateCannotBeChangedFromOutside() {
    ObjectNode value = JsonNodeFactory.instance.objectNode().put("count", 1);
    Map<String, JsonNode> values = new HashMap<>();
    values.put("progress", value);
    Execution execution = new Execution("run-1", "deploy", values, "s1");

    value.put("count", 2);
    values.put("other", value);

    assertEquals(1, execution.stateValues().get("progress").get("count").asInt());
    assertEquals(1, execution.stateValues().size());
    assertThrows(
        UnsupportedOperationException.class, () -> execution.stateValues().remove("progress"));
  }
}
