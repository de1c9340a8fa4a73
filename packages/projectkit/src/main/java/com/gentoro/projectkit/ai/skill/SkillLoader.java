package com.gentoro.projectkit.ai.skill;

import com.gentoro.projectkit.exception.ProjectKitErrorCode;
import com.gentoro.projectkit.exception.ProjectKitException;
import com.gentoro.projectkit.fs.SourceFs;
import com.gentoro.projectkit.fs.SourcePaths;
import com.gentoro.projectkit.loader.FlatFileLoader;
import com.gentoro.projectkit.loader.ResourceKind;
import com.gentoro.projectkit.loader.ResourceLoader;
import com.gentoro.projectkit.logging.LoggingService;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Loads skills stored one per directory:
 *
 * <pre>
 * &lt;skill&gt;/metadata.yaml      name and description
 * &lt;skill&gt;/instructions.md    free text instructions
 * &lt;skill&gt;/scripts/*          optional scripts
 * </pre>
 *
 * Files at the top level of the source are ignored. The first failing skill aborts the load.
 */
public class SkillLoader implements ResourceLoader<Skill> {
  private static final Logger log = LoggingService.getLogger(SkillLoader.class);

  static final String METADATA_FILE = "metadata.yaml";
  static final String INSTRUCTIONS_FILE = "instructions.md";
  static final String SCRIPTS_DIR = "scripts";

  private static final ResourceKind KIND = ResourceKind.SKILL;

  private final SkillMetadataValidator metadataValidator = new SkillMetadataValidator();

  @Override
  public List<Skill> load(SourceFs fs) {
    List<String> dirs = resolveSkillDirectories(fs);
    if (dirs.isEmpty()) {
      throw new ProjectKitException(
          KIND.noneFoundCode().orElseThrow(), "No skills found", Map.of("kind", KIND.label()));
    }

    List<Skill> skills = new ArrayList<>(dirs.size());
    for (String dir : dirs) {
      skills.add(loadSkill(fs.scoped(dir).readOnly(), dir));
    }
    log.debug("Loaded {} skills", skills.size());
    return List.copyOf(skills);
  }

  private List<String> resolveSkillDirectories(SourceFs fs) {
    List<String> dirs = new ArrayList<>();
    for (SourceFs.Entry entry : listDirectory(fs, SourcePaths.ROOT, SourcePaths.ROOT)) {
      if (entry.directory()) dirs.add(entry.name());
    }
    return dirs;
  }

  Skill loadSkill(SourceFs skillFs, String dir) {
    String metadataPath = dir + "/" + METADATA_FILE;
    byte[] metadataBytes = readFile(skillFs, METADATA_FILE, metadataPath);
    SkillMetadata metadata =
        FlatFileLoader.parseYaml(metadataBytes, SkillMetadata.class, metadataPath, KIND);
    FlatFileLoader.validate(metadata, metadataValidator, metadataPath, KIND);

    String instructions =
        new String(
            readFile(skillFs, INSTRUCTIONS_FILE, dir + "/" + INSTRUCTIONS_FILE),
            StandardCharsets.UTF_8);

    return new Skill(metadata, instructions, loadScripts(skillFs, dir));
  }

  private Map<String, Script> loadScripts(SourceFs skillFs, String dir) {
    String scriptsPath = dir + "/" + SCRIPTS_DIR;
    boolean present;
    try {
      present = skillFs.isDirectory(SCRIPTS_DIR);
    } catch (ProjectKitException e) {
      throw readFailed(scriptsPath, e);
    }

    Map<String, Script> scripts = new LinkedHashMap<>();
    if (!present) return scripts;

    for (SourceFs.Entry entry : listDirectory(skillFs, SCRIPTS_DIR, scriptsPath)) {
      if (entry.directory()) continue;
      String name = entry.name();
      byte[] content = readFile(skillFs, SCRIPTS_DIR + "/" + name, scriptsPath + "/" + name);
      scripts.put(name, new Script(ScriptContentTypes.forFileName(name), content));
    }
    return scripts;
  }

  private static List<SourceFs.Entry> listDirectory(SourceFs fs, String dir, String displayPath) {
    try {
      return fs.list(dir);
    } catch (ProjectKitException e) {
      throw readFailed(displayPath, e);
    }
  }

  private static byte[] readFile(SourceFs fs, String path, String displayPath) {
    try {
      return fs.read(path);
    } catch (ProjectKitException e) {
      throw readFailed(displayPath, e);
    }
  }

  private static ProjectKitException readFailed(String path, ProjectKitException cause) {
    return new ProjectKitException(
        ProjectKitErrorCode.READ_FAILED,
        "Failed to read " + path + ": " + cause.getMessage(),
        Map.of("path", path, "kind", KIND.label()),
        cause);
  }
}
