package com.gentoro.projectkit.fs;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.projectkit.exception.ExceptionUtil;
import com.gentoro.projectkit.exception.IoException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalSourceFsTest {

  @TempDir Path tempDir;

  @Test
  void readsWritesAndListsRelativeToRoot() throws Exception {
    Files.createDirectories(tempDir.resolve("sub"));
    Files.writeString(tempDir.resolve("a.yaml"), "a: 1");
    LocalSourceFs fs = new LocalSourceFs(tempDir);

    fs.write("sub/b.json", "{}".getBytes(StandardCharsets.UTF_8));

    List<SourceFs.Entry> entries =
        fs.list(".").stream().sorted(Comparator.comparing(SourceFs.Entry::name)).toList();
    assertEquals(
        List.of(new SourceFs.Entry("a.yaml", false), new SourceFs.Entry("sub", true)), entries);
    assertEquals("{}", Files.readString(tempDir.resolve("sub/b.json")));
    assertEquals("a: 1", fs.readString("a.yaml"));
    assertTrue(fs.isDirectory("sub"));
    assertFalse(fs.isDirectory("a.yaml"));
    assertFalse(fs.isDirectory("missing"));
  }

  @Test
  void absolutePathsAreHonored() throws Exception {
    Path file = tempDir.resolve("abs.txt");
    Files.writeString(file, "abs");

    LocalSourceFs fs = new LocalSourceFs(tempDir.resolve("elsewhere"));

    assertEquals("abs", fs.readString(file.toString()));
  }

  @Test
  void failuresKeepIoExceptionAsCause() {
    LocalSourceFs fs = new LocalSourceFs(tempDir);

    IoException e = assertThrows(IoException.class, () -> fs.read("missing.yaml"));
    assertTrue(ExceptionUtil.findCause(e, NoSuchFileException.class).isPresent());
    assertEquals("missing.yaml", e.getContext().get("path"));
  }

  @Test
  void createDirectoriesAndRemove() {
    LocalSourceFs fs = new LocalSourceFs(tempDir);

    fs.createDirectories("x/y/z");
    assertTrue(Files.isDirectory(tempDir.resolve("x/y/z")));

    fs.remove("x/y/z");
    assertFalse(fs.exists("x/y/z"));
    assertTrue(fs.exists("x/y"));
  }
}
