package com.gentoro.projectkit.rulebook;

import com.gentoro.projectkit.ai.AiConfig;
import com.gentoro.projectkit.ai.instruction.InstructionLoader;
import com.gentoro.projectkit.ai.mcp.McpServerLoader;
import com.gentoro.projectkit.ai.skill.SkillLoader;
import com.gentoro.projectkit.ai.workflow.WorkflowLoader;
import com.gentoro.projectkit.doc.DocConfig;
import com.gentoro.projectkit.doc.standard.StandardLoader;
import com.gentoro.projectkit.exception.ExceptionUtil;
import com.gentoro.projectkit.exception.ProjectKitErrorCode;
import com.gentoro.projectkit.exception.ProjectKitException;
import com.gentoro.projectkit.fs.SourceFs;
import com.gentoro.projectkit.loader.FlatFileLoader;
import com.gentoro.projectkit.loader.ResourceKind;
import com.gentoro.projectkit.loader.ResourceLoader;
import com.gentoro.projectkit.loader.SourceAggregator;
import com.gentoro.projectkit.loader.Violations;
import com.gentoro.projectkit.logging.LoggingService;
import com.gentoro.projectkit.source.DriverRegistryImpl;
import com.gentoro.projectkit.source.SourceResolverImpl;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Loads a rulebook: a directory with a {@code rulebook.yaml} describing where, inside the same
 * directory, each resource kind lives.
 *
 * <p>The sources of a rulebook are resolved by a registry private to the rulebook that only knows
 * the {@code rulebook} scheme, so a rulebook cannot reach outside its own directory.
 */
public class RulebookLoader implements ResourceLoader<Rulebook> {
  private static final Logger log = LoggingService.getLogger(RulebookLoader.class);

  public static final String METADATA_FILE = "rulebook.yaml";
  private static final ResourceKind KIND = ResourceKind.RULEBOOK;

  @Override
  public List<Rulebook> load(SourceFs fs) {
    return List.of(loadRulebook(fs));
  }

  public Rulebook loadRulebook(SourceFs fs) {
    RulebookMetadata metadata = loadMetadata(fs);
    AiConfig ai = metadata.ai() == null ? AiConfig.empty() : metadata.ai();
    DocConfig doc = metadata.doc() == null ? DocConfig.empty() : metadata.doc();

    DriverRegistryImpl registry = new DriverRegistryImpl();
    registry.registerDriver(new RulebookDriver(fs));
    SourceAggregator aggregator = new SourceAggregator(new SourceResolverImpl(registry));

    Rulebook rulebook =
        new Rulebook(
            new Rulebook.Ai(
                aggregator.aggregate(
                    ResourceKind.INSTRUCTIONS, ai.instruction(), new InstructionLoader()),
                aggregator.aggregate(ResourceKind.SKILL, ai.skill(), new SkillLoader()),
                aggregator.aggregate(ResourceKind.WORKFLOW, ai.workflow(), new WorkflowLoader()),
                aggregator.aggregate(ResourceKind.MCP_SERVER, ai.mcp(), new McpServerLoader())),
            new Rulebook.Doc(
                aggregator.aggregate(ResourceKind.STANDARD, doc.standard(), new StandardLoader())));

    log.debug(
        "Loaded rulebook: {} instructions, {} skills, {} workflows, {} mcp servers, {} standards",
        rulebook.ai().instructions().size(),
        rulebook.ai().skills().size(),
        rulebook.ai().workflows().size(),
        rulebook.ai().mcpServers().size(),
        rulebook.doc().standards().size());
    return rulebook;
  }

  RulebookMetadata loadMetadata(SourceFs fs) {
    boolean exists;
    try {
      exists = fs.exists(METADATA_FILE);
    } catch (ProjectKitException e) {
      throw ExceptionUtil.wrap("check " + METADATA_FILE, e);
    }
    if (!exists) {
      throw new ProjectKitException(
          ProjectKitErrorCode.RULEBOOK_METADATA_MISSING,
          "Missing " + METADATA_FILE,
          Map.of("path", METADATA_FILE));
    }

    byte[] data;
    try {
      data = fs.read(METADATA_FILE);
    } catch (ProjectKitException e) {
      throw new ProjectKitException(
          ProjectKitErrorCode.READ_FAILED,
          "Failed to read " + METADATA_FILE + ": " + e.getMessage(),
          Map.of("path", METADATA_FILE, "kind", KIND.label()),
          e);
    }

    RulebookMetadata metadata =
        FlatFileLoader.parseYaml(data, RulebookMetadata.class, METADATA_FILE, KIND);
    FlatFileLoader.validate(metadata, RulebookLoader::validateMetadata, METADATA_FILE, KIND);
    return metadata;
  }

  static List<String> validateMetadata(RulebookMetadata metadata) {
    Violations v = new Violations();
    AiConfig ai = metadata.ai();
    if (ai != null) {
      v.sources("ai.instruction", ai.instruction());
      v.sources("ai.skill", ai.skill());
      v.sources("ai.workflow", ai.workflow());
      v.sources("ai.mcp", ai.mcp());
    }
    if (metadata.doc() != null) {
      v.sources("doc.standard", metadata.doc().standard());
    }
    return v.toList();
  }
}
