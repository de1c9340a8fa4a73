package com.gentoro.projectkit.loader;

import java.util.List;

/**
 * Structural validation of a parsed resource.
 *
 * @param <T> record type
 */
@FunctionalInterface
public interface ResourceValidator<T> {

  /** @return the violated constraints; empty when the resource is valid. */
  List<String> validate(T resource);
}
