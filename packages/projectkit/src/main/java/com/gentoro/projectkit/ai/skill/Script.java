package com.gentoro.projectkit.ai.skill;

import java.util.Arrays;
import java.util.Objects;

/** A script shipped with a skill. Content is kept as raw bytes (base64 in JSON). */
public record Script(String contentType, byte[] content) {

  public Script {
    content = content == null ? null : content.clone();
  }

  /** @return a copy of the script bytes. */
  @Override
  public byte[] content() {
    return content == null ? null : content.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Script other)) return false;
    return Objects.equals(contentType, other.contentType) && Arrays.equals(content, other.content);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hashCode(contentType) + Arrays.hashCode(content);
  }

  @Override
  public String toString() {
    return "Script{contentType="
        + contentType
        + ", size="
        + (content == null ? 0 : content.length)
        + '}';
  }
}
