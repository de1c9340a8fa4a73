package com.gentoro.projectkit.project;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.projectkit.ai.instruction.Instructions;
import com.gentoro.projectkit.fs.MemorySourceFs;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProjectRepositoriesTest {

  @Test
  void repositoriesLiveInTheirOwnDirectories() {
    MemorySourceFs fs = new MemorySourceFs();
    ProjectRepositories repositories = new ProjectRepositories(fs);

    repositories.instructions().addInstructions(new Instructions("git", List.of("Sign commits")));
    repositories.skills();
    repositories.mcpServers();
    repositories.workflows();
    repositories.standards();

    assertEquals(1, fs.list(ProjectRepositories.INSTRUCTION_DIR).size());
    assertTrue(fs.isDirectory(ProjectRepositories.SKILL_DIR));
    assertTrue(fs.isDirectory(ProjectRepositories.MCP_DIR));
    assertTrue(fs.isDirectory(ProjectRepositories.WORKFLOW_DIR));
    assertTrue(fs.isDirectory(ProjectRepositories.EXECUTION_DIR));
    assertTrue(fs.isDirectory(ProjectRepositories.STANDARD_DIR));
  }

  @Test
  void sameInstanceIsReturned() {
    ProjectRepositories repositories = new ProjectRepositories(new MemorySourceFs());

    assertSame(repositories.skills(), repositories.skills());
    assertSame(repositories.workflows(), repositories.workflows());
  }

  @Test
  void contentsSurviveANewRepositoriesInstance() {
    MemorySourceFs fs = new MemorySourceFs();
    new ProjectRepositories(fs)
        .instructions()
        .addInstructions(new Instructions("java", List.of("Use records")));

    assertEquals(
        List.of(new Instructions("java", List.of("Use records"))),
        new ProjectRepositories(fs).instructions().getAll());
  }
}
