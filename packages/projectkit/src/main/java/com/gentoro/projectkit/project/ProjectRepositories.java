package com.gentoro.projectkit.project;

import com.gentoro.projectkit.ai.instruction.FsInstructionRepository;
import com.gentoro.projectkit.ai.instruction.InstructionRepository;
import com.gentoro.projectkit.ai.mcp.FsMcpServerRepository;
import com.gentoro.projectkit.ai.mcp.McpServerRepository;
import com.gentoro.projectkit.ai.skill.FsSkillRepository;
import com.gentoro.projectkit.ai.skill.SkillRepository;
import com.gentoro.projectkit.ai.workflow.FsWorkflowRepository;
import com.gentoro.projectkit.ai.workflow.WorkflowRepository;
import com.gentoro.projectkit.doc.standard.FsStandardRepository;
import com.gentoro.projectkit.doc.standard.StandardRepository;
import com.gentoro.projectkit.exception.ExceptionUtil;
import com.gentoro.projectkit.exception.ProjectKitException;
import com.gentoro.projectkit.fs.SourceFs;
import java.util.Objects;

/**
 * Repositories of a project, stored below {@value #REPOSITORY_ROOT} in the project root. The
 * directory of a repository is created the first time the repository is requested; the same
 * instance is returned afterwards.
 */
public class ProjectRepositories {
  public static final String REPOSITORY_ROOT = ".projectkit/repository";
  public static final String INSTRUCTION_DIR = REPOSITORY_ROOT + "/ai/instruction";
  public static final String SKILL_DIR = REPOSITORY_ROOT + "/ai/skill";
  public static final String MCP_DIR = REPOSITORY_ROOT + "/ai/mcp";
  public static final String WORKFLOW_DIR = REPOSITORY_ROOT + "/ai/workflow/workflows";
  public static final String EXECUTION_DIR = REPOSITORY_ROOT + "/ai/workflow/executions";
  public static final String STANDARD_DIR = REPOSITORY_ROOT + "/doc/standard";

  private final SourceFs projectFs;

  private InstructionRepository instructions;
  private SkillRepository skills;
  private McpServerRepository mcpServers;
  private WorkflowRepository workflows;
  private StandardRepository standards;

  public ProjectRepositories(SourceFs projectFs) {
    this.projectFs = Objects.requireNonNull(projectFs, "projectFs");
  }

  public synchronized InstructionRepository instructions() {
    if (instructions == null) {
      instructions = new FsInstructionRepository(directory(INSTRUCTION_DIR));
    }
    return instructions;
  }

  public synchronized SkillRepository skills() {
    if (skills == null) {
      skills = new FsSkillRepository(directory(SKILL_DIR));
    }
    return skills;
  }

  public synchronized McpServerRepository mcpServers() {
    if (mcpServers == null) {
      mcpServers = new FsMcpServerRepository(directory(MCP_DIR));
    }
    return mcpServers;
  }

  public synchronized WorkflowRepository workflows() {
    if (workflows == null) {
      workflows =
          new FsWorkflowRepository(directory(WORKFLOW_DIR), directory(EXECUTION_DIR));
    }
    return workflows;
  }

  public synchronized StandardRepository standards() {
    if (standards == null) {
      standards = new FsStandardRepository(directory(STANDARD_DIR));
    }
    return standards;
  }

  private SourceFs directory(String path) {
    try {
      projectFs.createDirectories(path);
    } catch (ProjectKitException e) {
      throw ExceptionUtil.wrap("create repository directory " + path, e);
    }
    return projectFs.scoped(path);
  }
}
