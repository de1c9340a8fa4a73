package com.gentoro.projectkit.loader;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.projectkit.source.SourceConfig;
import com.gentoro.projectkit.source.SourcesConfig;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ViolationsTest {

  @Test
  void requiredTreatsNullAndEmptyStringAsMissing() {
    Violations v = new Violations();

    assertFalse(v.required("a", null));
    assertFalse(v.required("b", ""));
    assertTrue(v.required("c", " "));
    assertEquals(List.of("a is required", "b is required"), v.toList());
  }

  @Test
  void lengthCountsCodePoints() {
    Violations v = new Violations();

    v.maxLength("emoji", "😀😀", 2);
    v.length("short", "abc", 10, 20);
    v.length("skipped", null, 10, 20);

    assertEquals(List.of("short must be at least 10 characters long"), v.toList());
  }

  @Test
  void semverAcceptsPreReleaseAndBuild() {
    Violations v = new Violations();

    v.semver("a", "1.0.0");
    v.semver("b", "2.10.3-rc.1+build.5");
    assertTrue(v.isEmpty());

    v.semver("c", "1.0");
    v.semver("d", "01.0.0");
    assertEquals(2, v.toList().size());
  }

  @Test
  void eachPassesIndexedPath() {
    Violations v = new Violations();

    v.each("items", Arrays.asList("x", null), (path, item) -> v.required(path, item));
    v.oneOf("level", "shall", Set.of("must"));
    v.url("link", "not a url");
    v.url("rel", "relative/path");
    v.url("ok", "https://example.com/std");

    List<String> list = v.toList();
    assertEquals("items[1] is required", list.get(0));
    assertTrue(list.get(1).startsWith("level must be one of"));
    assertEquals(4, list.size());
  }

  @Test
  void sourcesRequireUris() {
    Violations v = new Violations();

    v.sources(
        "ai.skill",
        new SourcesConfig(List.of(new SourceConfig("local://a"), new SourceConfig(""))));
    v.sources("ai.mcp", null);

    assertEquals(List.of("ai.skill.sources[1].uri is required"), v.toList());
  }
}
