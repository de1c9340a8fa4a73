package com.gentoro.projectkit.source;

import java.util.ArrayList;
import java.util.List;

/** Ordered list of sources configured for one resource kind. The order is significant. */
public record SourcesConfig(List<SourceConfig> sources) {

  public static SourcesConfig empty() {
    return new SourcesConfig(List.of());
  }

  public static SourcesConfig of(String... uris) {
    List<SourceConfig> sources = new ArrayList<>();
    for (String uri : uris) {
      sources.add(new SourceConfig(uri));
    }
    return new SourcesConfig(sources);
  }

  /** @return the configured URIs in order; never null. */
  public List<String> uris() {
    if (sources == null) return List.of();
    return sources.stream().map(s -> s == null ? null : s.uri()).toList();
  }

  /** @return a new config with the sources of {@code this} followed by those of {@code other}. */
  public SourcesConfig concat(SourcesConfig other) {
    List<SourceConfig> merged = new ArrayList<>();
    if (sources != null) merged.addAll(sources);
    if (other != null && other.sources() != null) merged.addAll(other.sources());
    return new SourcesConfig(merged);
  }
}
