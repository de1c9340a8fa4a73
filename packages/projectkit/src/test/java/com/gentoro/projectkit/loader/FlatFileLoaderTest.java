package com.gentoro.projectkit.loader;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.projectkit.ai.instruction.InstructionLoader;
import com.gentoro.projectkit.ai.instruction.Instructions;
import com.gentoro.projectkit.exception.ExceptionUtil;
import com.gentoro.projectkit.exception.IoException;
import com.gentoro.projectkit.exception.ProjectKitErrorCode;
import com.gentoro.projectkit.exception.ProjectKitException;
import com.gentoro.projectkit.exception.ValidationException;
import com.gentoro.projectkit.fs.MemorySourceFs;
import com.gentoro.projectkit.fs.SourceFs;
import java.nio.file.AccessDeniedException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FlatFileLoaderTest {

  private final InstructionLoader loader = new InstructionLoader();

  @Test
  void loadsYamlFilesInListingOrderAndSkipsEverythingElse() {
    MemorySourceFs fs =
        new MemorySourceFs()
            .withFile("b.yaml", "category: testing\nrules:\n  - write tests\n")
            .withFile("a.YML", "category: git\nrules:\n  - small commits\n  - rebase often\n")
            .withFile("README.md", "# not a resource")
            .withFile("nested/c.yaml", "category: ignored\nrules: [x]\n");

    List<Instructions> loaded = loader.load(fs);

    assertEquals(
        List.of(
            new Instructions("git", List.of("small commits", "rebase often")),
            new Instructions("testing", List.of("write tests"))),
        loaded);
  }

  @Test
  void unknownFieldsAreIgnored() {
    MemorySourceFs fs =
        new MemorySourceFs().withFile("x.yaml", "category: git\nrules: [a]\nowner: platform\n");

    assertEquals(List.of(new Instructions("git", List.of("a"))), loader.load(fs));
  }

  @Test
  void sourceWithoutYamlFilesHasNoInstructions() {
    MemorySourceFs fs = new MemorySourceFs().withFile("notes.txt", "x").withDirectory("dir.yaml");

    ProjectKitException e = assertThrows(ProjectKitException.class, () -> loader.load(fs));
    assertEquals(ProjectKitErrorCode.NO_INSTRUCTIONS_FOUND, e.getCode());
  }

  @Test
  void malformedYamlIsParseFailureNamingTheFile() {
    MemorySourceFs fs =
        new MemorySourceFs()
            .withFile("a.yaml", "category: git\nrules: [a]\n")
            .withFile("broken.yaml", "category: [git\n");

    ProjectKitException e = assertThrows(ProjectKitException.class, () -> loader.load(fs));
    assertEquals(ProjectKitErrorCode.PARSE_FAILED, e.getCode());
    assertEquals("broken.yaml", e.getContext().get("path"));
  }

  @Test
  void emptyDocumentIsParseFailure() {
    MemorySourceFs fs = new MemorySourceFs().withFile("empty.yaml", "");

    ProjectKitException e = assertThrows(ProjectKitException.class, () -> loader.load(fs));
    assertEquals(ProjectKitErrorCode.PARSE_FAILED, e.getCode());
  }

  @Test
  void structuralViolationsAreListed() {
    MemorySourceFs fs = new MemorySourceFs().withFile("x.yaml", "rules: []\n");

    ValidationException e = assertThrows(ValidationException.class, () -> loader.load(fs));
    assertEquals(ProjectKitErrorCode.VALIDATION_FAILED, e.getCode());
    assertEquals(
        List.of("category is required", "rules must contain at least one element"),
        e.getViolations());
    assertEquals("x.yaml", e.getContext().get("path"));
  }

  @Test
  void unreadableFileIsReadFailureKeepingCause() {
    SourceFs fs = mock(SourceFs.class);
    when(fs.list(".")).thenReturn(List.of(new SourceFs.Entry("locked.yaml", false)));
    when(fs.read("locked.yaml"))
        .thenThrow(
            new IoException(
                "denied", Map.of("path", "locked.yaml"), new AccessDeniedException("locked.yaml")));

    ProjectKitException e = assertThrows(ProjectKitException.class, () -> loader.load(fs));

    assertEquals(ProjectKitErrorCode.READ_FAILED, e.getCode());
    assertTrue(ExceptionUtil.findCause(e, AccessDeniedException.class).isPresent());
  }

  @Test
  void listingFailureIsReadFailure() {
    SourceFs fs = mock(SourceFs.class);
    when(fs.list(".")).thenThrow(new IoException("gone"));

    ProjectKitException e = assertThrows(ProjectKitException.class, () -> loader.load(fs));
    assertEquals(ProjectKitErrorCode.READ_FAILED, e.getCode());
  }

  @Test
  void loadedRulesAreReadOnly() {
    MemorySourceFs fs = new MemorySourceFs().withFile("x.yaml", "category: git\nrules: [r]\n");
    Instructions instructions = loader.load(fs).get(0);

    assertThrows(UnsupportedOperationException.class, () -> instructions.rules().add("other"));
    assertEquals(List.of("r"), instructions.rules());
  }

  @Test
  void kindWithoutNoneFoundCodeCannotBeLoadedFromFlatFiles() {
    assertTrue(ResourceKind.RULEBOOK.noneFoundCode().isEmpty());
    assertEquals(
        ProjectKitErrorCode.NO_WORKFLOWS_FOUND,
        ResourceKind.WORKFLOW.noneFoundCode().orElseThrow());

    assertThrows(
        IllegalArgumentException.class,
        () -> new FlatFileLoader<>(ResourceKind.RULEBOOK, Instructions.class, i -> List.of()));
  }
}
