package com.gentoro.projectkit.project;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.gentoro.projectkit.exception.ConfigException;
import com.gentoro.projectkit.exception.IoException;
import com.gentoro.projectkit.exception.ProjectKitErrorCode;
import com.gentoro.projectkit.fs.MemorySourceFs;
import com.gentoro.projectkit.fs.SourceFs;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProjectConfigLoaderTest {

  private static final String HOME = "/home/dev";
  private static final String WORK = "/work/app";

  @Mock private SourceFs brokenFs;

  private static ProjectConfigLoader loader(MemorySourceFs fs) {
    return new ProjectConfigLoader(fs, HOME, WORK);
  }

  @Test
  void homeSourcesComeBeforeWorkingDirectorySources() {
    MemorySourceFs fs =
        new MemorySourceFs()
            .withFile(
                HOME + "/.projectkit.yaml",
                """
                rulebook:
                  sources:
                    - uri: local://home-rules
                ai:
                  instruction:
                    sources:
                      - uri: local://home/instructions
                """)
            .withFile(
                WORK + "/.projectkit.yaml",
                """
                ai:
                  instruction:
                    sources:
                      - uri: local://ai/instructions
                  mcp:
                    sources:
                      - uri: local://ai/mcp
                doc:
                  standard:
                    sources:
                      - uri: local://doc/standards
                """);

    ProjectConfig config = loader(fs).load();

    assertEquals(List.of("local://home-rules"), config.rulebook().uris());
    assertEquals(
        List.of("local://home/instructions", "local://ai/instructions"),
        config.ai().instruction().uris());
    assertEquals(List.of("local://ai/mcp"), config.ai().mcp().uris());
    assertEquals(List.of(), config.ai().skill().uris());
    assertEquals(List.of("local://doc/standards"), config.doc().standard().uris());
  }

  @Test
  void sameDirectoryIsReadOnce() {
    MemorySourceFs fs =
        new MemorySourceFs()
            .withFile(
                WORK + "/.projectkit.yaml",
                "ai:\n  skill:\n    sources:\n      - uri: local://skills\n");

    ProjectConfigLoader loader = new ProjectConfigLoader(fs, WORK, WORK + "/.");

    assertEquals(List.of(WORK + "/.projectkit.yaml"), loader.resolvePaths());
    assertEquals(List.of("local://skills"), loader.load().ai().skill().uris());
  }

  @Test
  void onlyWorkingDirectoryFile() {
    MemorySourceFs fs =
        new MemorySourceFs().withFile(WORK + "/.projectkit.yaml", "doc:\n  standard: {}\n");

    ProjectConfig config = loader(fs).load();

    assertEquals(List.of(), config.doc().standard().uris());
    assertEquals(List.of(), config.rulebook().uris());
  }

  @Test
  void blankFileIsEmptyConfiguration() {
    MemorySourceFs fs = new MemorySourceFs().withFile(HOME + "/.projectkit.yaml", "  \n");

    assertEquals(ProjectConfig.empty(), loader(fs).load());
  }

  @Test
  void noConfigurationFile() {
    ConfigException e =
        assertThrows(ConfigException.class, () -> loader(new MemorySourceFs()).load());
    assertEquals(ProjectKitErrorCode.CONFIG_NOT_FOUND, e.getCode());
  }

  @Test
  void malformedYaml() {
    MemorySourceFs fs =
        new MemorySourceFs().withFile(WORK + "/.projectkit.yaml", "ai: [unterminated\n");

    ConfigException e = assertThrows(ConfigException.class, () -> loader(fs).load());
    assertEquals(ProjectKitErrorCode.CONFIG_LOAD_FAILED, e.getCode());
    assertEquals(WORK + "/.projectkit.yaml", e.getContext().get("path"));
  }

  @Test
  void configuredRulebookSectionNeedsSources() {
    MemorySourceFs fs =
        new MemorySourceFs().withFile(WORK + "/.projectkit.yaml", "rulebook:\n  sources: []\n");

    ConfigException e = assertThrows(ConfigException.class, () -> loader(fs).load());
    assertEquals(ProjectKitErrorCode.CONFIG_VALIDATION_FAILED, e.getCode());
    assertTrue(e.getMessage().contains("rulebook.sources must contain at least one element"));
  }

  @Test
  void sourceWithoutUri() {
    MemorySourceFs fs =
        new MemorySourceFs()
            .withFile(WORK + "/.projectkit.yaml", "ai:\n  workflow:\n    sources:\n      - {}\n");

    ConfigException e = assertThrows(ConfigException.class, () -> loader(fs).load());
    assertEquals(ProjectKitErrorCode.CONFIG_VALIDATION_FAILED, e.getCode());
    assertTrue(e.getMessage().contains("ai.workflow.sources[0].uri is required"));
  }

  @Test
  void unreadableFileIsLoadFailure() {
    when(brokenFs.exists(anyString())).thenReturn(true);
    when(brokenFs.read(anyString()))
        .thenThrow(new IoException("Failed to read file", Map.of(), new RuntimeException("EIO")));

    ProjectConfigLoader loader = new ProjectConfigLoader(brokenFs, null, WORK);

    ConfigException e = assertThrows(ConfigException.class, loader::load);
    assertEquals(ProjectKitErrorCode.CONFIG_LOAD_FAILED, e.getCode());
    assertInstanceOf(IoException.class, e.getCause());
  }
}
