package com.gentoro.projectkit.ai.workflow;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.projectkit.exception.ProjectKitErrorCode;
import com.gentoro.projectkit.exception.ProjectKitException;
import com.gentoro.projectkit.exception.ValidationException;
import com.gentoro.projectkit.fs.MemorySourceFs;
import java.util.List;
import org.junit.jupiter.api.Test;

class WorkflowLoaderTest {

  private static final String RELEASE =
      """
      metadata:
        id: release-flow
        name: Release
        description: Cut a release
        version: 1.2.0
      state:
        tag:
          type: string
          pattern: "^v"
      steps:
        - id: bump
          name: Bump version
          description: Update the version number
          instructions:
            - Edit the pom
            - Commit the change
        - id: tag
          name: Tag
          description: Tag the commit
          instructions: [Create the tag]
      """;

  private final WorkflowLoader loader = new WorkflowLoader();

  @Test
  void loadsWorkflowWithStateSchema() {
    List<Workflow> workflows = loader.load(new MemorySourceFs().withFile("release.yaml", RELEASE));

    assertEquals(1, workflows.size());
    Workflow workflow = workflows.get(0);
    assertEquals(
        new WorkflowMetadata("release-flow", "Release", "Cut a release", "1.2.0"),
        workflow.metadata());
    assertEquals("string", workflow.state().get("tag").get("type").asText());
    assertEquals("^v", workflow.state().get("tag").get("pattern").asText());
    assertEquals(List.of("bump", "tag"), workflow.steps().stream().map(WorkflowStep::id).toList());
    assertEquals(
        List.of("Edit the pom", "Commit the change"), workflow.steps().get(0).instructions());
  }

  @Test
  void reportsEveryViolation() {
    String yaml =
        """
        metadata:
          id: "not valid!"
          name: Broken
          version: one
        steps:
          - id: only
            name: Only
            description: The only step
            instructions: []
        """;

    ValidationException e =
        assertThrows(
            ValidationException.class,
            () -> loader.load(new MemorySourceFs().withFile("broken.yaml", yaml)));

    assertEquals(ProjectKitErrorCode.VALIDATION_FAILED, e.getCode());
    assertEquals(
        List.of(
            "metadata.id must be alphanumeric with dashes, got 'not valid!'",
            "metadata.description is required",
            "metadata.version must be a semantic version, got 'one'",
            "steps[0].instructions must contain at least one element"),
        e.getViolations());
  }

  @Test
  void workflowWithoutStepsIsInvalid() {
    String yaml =
        "metadata:\n  id: a\n  name: A\n  description: d\n  version: 0.1.0\nsteps: []\n";

    ValidationException e =
        assertThrows(
            ValidationException.class,
            () -> loader.load(new MemorySourceFs().withFile("a.yaml", yaml)));
    assertEquals(List.of("steps must contain at least one element"), e.getViolations());
  }

  @Test
  void emptyFileIsParseFailure() {
    ProjectKitException e =
        assertThrows(
            ProjectKitException.class,
            () -> loader.load(new MemorySourceFs().withFile("empty.yaml", "")));
    assertEquals(ProjectKitErrorCode.PARSE_FAILED, e.getCode());
  }

  @Test
  void noWorkflowFiles() {
    ProjectKitException e =
        assertThrows(
            ProjectKitException.class,
            () -> loader.load(new MemorySourceFs().withDirectory("sub")));
    assertEquals(ProjectKitErrorCode.NO_WORKFLOWS_FOUND, e.getCode());
  }
}
