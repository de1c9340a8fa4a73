package com.gentoro.projectkit.action;

import com.gentoro.projectkit.ai.AiConfig;
import com.gentoro.projectkit.ai.instruction.InstructionLoader;
import com.gentoro.projectkit.ai.instruction.Instructions;
import com.gentoro.projectkit.ai.mcp.McpServer;
import com.gentoro.projectkit.ai.mcp.McpServerLoader;
import com.gentoro.projectkit.ai.mcp.StdioMcpServer;
import com.gentoro.projectkit.ai.skill.Skill;
import com.gentoro.projectkit.ai.skill.SkillLoader;
import com.gentoro.projectkit.ai.workflow.Workflow;
import com.gentoro.projectkit.ai.workflow.WorkflowLoader;
import com.gentoro.projectkit.doc.DocConfig;
import com.gentoro.projectkit.doc.standard.Standard;
import com.gentoro.projectkit.doc.standard.StandardLoader;
import com.gentoro.projectkit.exception.ExceptionUtil;
import com.gentoro.projectkit.exception.ProjectKitException;
import com.gentoro.projectkit.loader.ResourceKind;
import com.gentoro.projectkit.loader.SourceAggregator;
import com.gentoro.projectkit.logging.LoggingService;
import com.gentoro.projectkit.project.ProjectConfig;
import com.gentoro.projectkit.project.ProjectRepositories;
import com.gentoro.projectkit.rulebook.Rulebook;
import com.gentoro.projectkit.rulebook.RulebookLoader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;

/**
 * Refreshes the project repositories from the configured sources.
 *
 * <p>Every resource kind is loaded from its own sources first, then the rulebooks add their
 * resources after them. Only once everything loaded successfully are the repositories wiped and
 * filled again, so a broken source leaves the previous content untouched.
 */
public class UpdateAction {
  private static final Logger log = LoggingService.getLogger(UpdateAction.class);

  public static final String SELF_MCP_SERVER_NAME = "projectkit";
  public static final List<String> SELF_MCP_SERVER_ARGUMENTS = List.of("mcp", "server");

  private final ProjectConfig config;
  private final SourceAggregator aggregator;
  private final ProjectRepositories repositories;
  private final String executablePath;

  /**
   * @param executablePath command registered for the {@value #SELF_MCP_SERVER_NAME} MCP server
   */
  public UpdateAction(
      ProjectConfig config,
      SourceAggregator aggregator,
      ProjectRepositories repositories,
      String executablePath) {
    this.config = Objects.requireNonNull(config, "config");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.repositories = Objects.requireNonNull(repositories, "repositories");
    this.executablePath = Objects.requireNonNull(executablePath, "executablePath");
  }

  public void run() {
    AiConfig ai = config.ai() == null ? AiConfig.empty() : config.ai();
    DocConfig doc = config.doc() == null ? DocConfig.empty() : config.doc();

    List<Instructions> instructions =
        new ArrayList<>(
            aggregator.aggregate(
                ResourceKind.INSTRUCTIONS, ai.instruction(), new InstructionLoader()));
    List<Skill> skills =
        new ArrayList<>(aggregator.aggregate(ResourceKind.SKILL, ai.skill(), new SkillLoader()));
    List<Workflow> workflows =
        new ArrayList<>(
            aggregator.aggregate(ResourceKind.WORKFLOW, ai.workflow(), new WorkflowLoader()));
    List<McpServer> mcpServers =
        new ArrayList<>(
            aggregator.aggregate(ResourceKind.MCP_SERVER, ai.mcp(), new McpServerLoader()));
    List<Standard> standards =
        new ArrayList<>(
            aggregator.aggregate(ResourceKind.STANDARD, doc.standard(), new StandardLoader()));

    List<Rulebook> rulebooks =
        aggregator.aggregate(ResourceKind.RULEBOOK, config.rulebook(), new RulebookLoader());
    for (Rulebook rulebook : rulebooks) {
      instructions.addAll(rulebook.ai().instructions());
      skills.addAll(rulebook.ai().skills());
      workflows.addAll(rulebook.ai().workflows());
      mcpServers.addAll(rulebook.ai().mcpServers());
      standards.addAll(rulebook.doc().standards());
    }
    log.info("Loaded {} rulebook(s)", rulebooks.size());

    mcpServers.add(
        new McpServer(
            SELF_MCP_SERVER_NAME,
            new StdioMcpServer(executablePath, SELF_MCP_SERVER_ARGUMENTS, Map.of())));

    replace(
        "standards",
        standards,
        repositories.standards()::removeAll,
        repositories.standards()::addStandard);
    replace(
        "instructions",
        instructions,
        repositories.instructions()::removeAll,
        repositories.instructions()::addInstructions);
    replace("skills", skills, repositories.skills()::removeAll, repositories.skills()::addSkill);
    replace(
        "workflows",
        workflows,
        repositories.workflows()::removeAllWorkflows,
        repositories.workflows()::addWorkflow);
    replace(
        "mcp servers",
        mcpServers,
        repositories.mcpServers()::removeAll,
        repositories.mcpServers()::addMcpServer);
  }

  private static <T> void replace(
      String label, List<T> resources, Runnable removeAll, Consumer<T> add) {
    try {
      removeAll.run();
    } catch (ProjectKitException e) {
      throw ExceptionUtil.wrap("remove all " + label + " from repository", e);
    }
    for (T resource : resources) {
      try {
        add.accept(resource);
      } catch (ProjectKitException e) {
        throw ExceptionUtil.wrap("add " + label + " to repository", e);
      }
    }
    log.info("{} {} added to repository", resources.size(), label);
  }
}
