package com.gentoro.projectkit.doc;

import com.gentoro.projectkit.source.SourcesConfig;

/** Sources of the documentation resource kinds. */
public record DocConfig(SourcesConfig standard) {

  public static DocConfig empty() {
    return new DocConfig(null);
  }

  public DocConfig merge(DocConfig other) {
    if (other == null) return this;
    if (standard == null) return other;
    if (other.standard() == null) return this;
    return new DocConfig(standard.concat(other.standard()));
  }
}
