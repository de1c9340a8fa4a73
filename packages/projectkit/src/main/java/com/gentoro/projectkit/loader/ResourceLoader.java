package com.gentoro.projectkit.loader;

import com.gentoro.projectkit.fs.SourceFs;
import java.util.List;

/**
 * Loads every resource of one kind found in a source filesystem.
 *
 * <p>Implementations either return the complete list or throw; a partially loaded list is never
 * returned. A source without any resource is a failure with the kind's none-found code.
 *
 * @param <T> record type of the resource kind
 */
@FunctionalInterface
public interface ResourceLoader<T> {
  List<T> load(SourceFs fs);
}
